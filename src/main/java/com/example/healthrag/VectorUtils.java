package com.example.healthrag;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Storage codecs for embeddings: gzipped big-endian floats, with JSON kept as a readable fallback.
 */
public final class VectorUtils {

    private static final ObjectMapper mapper = new ObjectMapper();

    private VectorUtils() {}

    public static byte[] floatArrayToGzipBytes(float[] arr) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(baos);
             DataOutputStream dos = new DataOutputStream(gz)) {
            dos.writeInt(arr.length);
            for (float f : arr) dos.writeFloat(f);
        }
        return baos.toByteArray();
    }

    public static float[] gzipBytesToFloatArray(byte[] blob) throws IOException {
        try (GZIPInputStream gzis = new GZIPInputStream(new ByteArrayInputStream(blob));
             DataInputStream dis = new DataInputStream(gzis)) {
            int len = dis.readInt();
            float[] arr = new float[len];
            for (int i = 0; i < len; i++) arr[i] = dis.readFloat();
            return arr;
        }
    }

    public static String floatArrayToJson(float[] arr) throws IOException {
        return mapper.writeValueAsString(arr);
    }

    public static float[] jsonToFloatArray(String json) throws IOException {
        if (json == null || json.isBlank()) return null;
        return mapper.readValue(json, float[].class);
    }

    /**
     * Decodes whichever representation is present, preferring the blob.
     */
    public static float[] decode(byte[] blob, String json) throws IOException {
        if (blob != null && blob.length > 0) return gzipBytesToFloatArray(blob);
        return jsonToFloatArray(json);
    }
}
