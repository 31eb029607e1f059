package io;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;

import learning.HarmonyModels;

public class ModelIO {

	public static void writeModels(HarmonyModels models, String path) throws IOException {
		OutputStream fileOut = new FileOutputStream(path);
		try {
			ObjectOutputStream out = new ObjectOutputStream(new BufferedOutputStream(fileOut));
			out.writeObject(models);
			out.flush();
		} finally {
			fileOut.close();
		}
	}

	public static HarmonyModels readModels(String path) throws IOException {
		InputStream fileIn = new FileInputStream(path);
		try {
			ObjectInputStream in = new ObjectInputStream(new BufferedInputStream(fileIn));
			Object result = in.readObject();
			if (!(result instanceof HarmonyModels)) {
				throw new IOException(path+" does not contain harmony models: "+(result == null ? "null" : result.getClass().getName()));
			}
			return (HarmonyModels) result;
		} catch (ClassNotFoundException e) {
			throw new IOException(path+": "+e.getMessage(), e);
		} finally {
			fileIn.close();
		}
	}

}
