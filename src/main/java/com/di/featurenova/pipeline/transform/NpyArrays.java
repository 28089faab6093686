package com.di.featurenova.pipeline.transform;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * NumPy {@code .npy} format version 1.0 for 2-D little-endian float64
 * arrays in C order, readable with {@code numpy.load}.
 */
public final class NpyArrays {

    private static final byte[]  MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final int     PREAMBLE = MAGIC.length + 2 + 2;
    private static final Pattern SHAPE = Pattern.compile("'shape':\\s*\\((\\d+),\\s*(\\d+)\\)");

    private NpyArrays() {
    }

    /** Writes a new file; an existing file is an error. */
    public static void write(double[][] rows, int columns, Path file) throws IOException {
        Files.createDirectories(file.getParent());
        byte[] header = header(rows.length, columns);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE))) {
            out.write(MAGIC);
            out.write(1);
            out.write(0);
            out.write(header.length & 0xFF);
            out.write((header.length >>> 8) & 0xFF);
            out.write(header);
            ByteBuffer buf = ByteBuffer.allocate(8 * Math.max(columns, 1)).order(ByteOrder.LITTLE_ENDIAN);
            for (double[] row : rows) {
                if (row.length != columns) {
                    throw new IllegalArgumentException("Row has " + row.length + " values, expected " + columns);
                }
                buf.clear();
                for (double v : row) {
                    buf.putDouble(v);
                }
                out.write(buf.array(), 0, row.length * 8);
            }
        }
    }

    public static void write(FeatureMatrix matrix, Path file) throws IOException {
        write(matrix.rows(), matrix.width(), file);
    }

    public static double[][] read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        for (byte b : MAGIC) {
            if (buf.get() != b) {
                throw new IOException(file + " is not an .npy file");
            }
        }
        int major = buf.get();
        buf.get();
        if (major != 1) {
            throw new IOException(file + " uses unsupported .npy version " + major);
        }
        int headerLen = Short.toUnsignedInt(buf.getShort());
        String header = new String(bytes, PREAMBLE, headerLen, StandardCharsets.US_ASCII);
        if (!header.contains("'descr': '<f8'") || !header.contains("'fortran_order': False")) {
            throw new IOException(file + " is not a C-order <f8 array: " + header.trim());
        }
        Matcher m = SHAPE.matcher(header);
        if (!m.find()) {
            throw new IOException(file + " is not a 2-D array: " + header.trim());
        }
        int rows = Integer.parseInt(m.group(1));
        int cols = Integer.parseInt(m.group(2));
        buf.position(PREAMBLE + headerLen);
        if (buf.remaining() != (long) rows * cols * 8) {
            throw new IOException(file + " holds " + buf.remaining() + " data bytes, expected " + (long) rows * cols * 8);
        }
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                out[r][c] = buf.getDouble();
            }
        }
        return out;
    }

    /** Header dict padded with spaces so the data starts on a 64-byte boundary. */
    static byte[] header(int rows, int columns) {
        String dict = "{'descr': '<f8', 'fortran_order': False, 'shape': (" + rows + ", " + columns + "), }";
        int total = PREAMBLE + dict.length() + 1;
        int pad = (64 - total % 64) % 64;
        return (dict + " ".repeat(pad) + "\n").getBytes(StandardCharsets.US_ASCII);
    }
}
