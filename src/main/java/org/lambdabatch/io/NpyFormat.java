package org.lambdabatch.io;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal reader/writer for the NumPy {@code .npy} container.
 * <p>
 * Arrays are written as little-endian float64 in C order with a version 1.0 header. The reader
 * only parses the header, so the shape of a large cached map can be checked without loading it.
 * Writes go through a sibling temporary file that is moved into place once complete.
 */
public final class NpyFormat {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final int HEADER_ALIGNMENT = 64;
    private static final int MAX_HEADER_LENGTH = 1 << 20;
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");
    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'[<>|=]?[a-zA-Z](\\d+)'");
    private static final String TEMP_SUFFIX = ".part";

    private record Header(int[] shape, int itemSize, long dataOffset) {
        long payloadLength() {
            long elements = 1;
            for (int dim : shape) elements *= dim;
            return elements * itemSize;
        }
    }

    private NpyFormat() {
    }

    /**
     * Reads the array shape from the header of an {@code .npy} file and checks that the file holds
     * exactly the payload the header announces. The data itself is not read.
     *
     * @throws IOException If the file is not a readable npy container or its payload is truncated.
     */
    public static int[] readShape(Path file) throws IOException {
        Header header;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            header = readHeader(in);
        }
        long expected = header.dataOffset() + header.payloadLength();
        long actual = Files.size(file);
        if (actual != expected) {
            throw new IOException("Npy payload size mismatch in " + file + ": expected " + expected + " bytes, found " + actual);
        }
        return header.shape();
    }

    static int[] readShape(InputStream raw) throws IOException {
        return readHeader(raw).shape();
    }

    private static Header readHeader(InputStream raw) throws IOException {
        DataInputStream in = new DataInputStream(raw);
        byte[] magic = new byte[MAGIC.length];
        try {
            in.readFully(magic);
        } catch (EOFException e) {
            throw new IOException("Truncated npy header", e);
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (magic[i] != MAGIC[i]) throw new IOException("Not an npy file (bad magic)");
        }
        int major = in.readUnsignedByte();
        in.readUnsignedByte(); // minor
        long headerLength;
        int preamble;
        if (major == 1) {
            headerLength = Short.toUnsignedInt(Short.reverseBytes(in.readShort()));
            preamble = MAGIC.length + 2 + 2;
        } else if (major == 2 || major == 3) {
            headerLength = Integer.toUnsignedLong(Integer.reverseBytes(in.readInt()));
            preamble = MAGIC.length + 2 + 4;
        } else {
            throw new IOException("Unsupported npy version " + major);
        }
        if (headerLength > MAX_HEADER_LENGTH) throw new IOException("Npy header too large: " + headerLength);

        byte[] header = new byte[(int) headerLength];
        try {
            in.readFully(header);
        } catch (EOFException e) {
            throw new IOException("Truncated npy header", e);
        }
        String dict = new String(header, major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);
        Matcher matcher = SHAPE.matcher(dict);
        if (!matcher.find()) throw new IOException("Npy header has no shape: " + dict.trim());
        Matcher descr = DESCR.matcher(dict);
        if (!descr.find()) throw new IOException("Npy header has no usable descr: " + dict.trim());

        List<Integer> dims = new ArrayList<>();
        for (String token : matcher.group(1).split(",")) {
            String t = token.trim();
            if (t.isEmpty()) continue;
            // numpy may write longs as "12L" in old headers
            if (t.endsWith("L")) t = t.substring(0, t.length() - 1);
            try {
                int dim = Integer.parseInt(t);
                if (dim < 0) throw new IOException("Negative dimension '" + token + "' in npy header");
                dims.add(dim);
            } catch (NumberFormatException e) {
                throw new IOException("Bad dimension '" + token + "' in npy header", e);
            }
        }
        int[] shape = dims.stream().mapToInt(Integer::intValue).toArray();
        return new Header(shape, Integer.parseInt(descr.group(1)), preamble + headerLength);
    }

    public static void write(Path file, double[] values) throws IOException {
        Path temp = tempSibling(file);
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                writeHeader(out, "(" + values.length + ",)");
                writeDoubles(out, values);
            }
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Writes a rectangular 2-D array; all rows must have the same length.
     */
    public static void write(Path file, double[][] values) throws IOException {
        int rows = values.length;
        int cols = rows == 0 ? 0 : values[0].length;
        for (double[] row : values) {
            if (row.length != cols) throw new IllegalArgumentException("Ragged array cannot be stored as npy");
        }
        Path temp = tempSibling(file);
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                writeHeader(out, "(" + rows + ", " + cols + ")");
                for (double[] row : values) writeDoubles(out, row);
            }
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static Path tempSibling(Path file) {
        return file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
    }

    private static void writeHeader(OutputStream out, String shape) throws IOException {
        StringBuilder dict = new StringBuilder("{'descr': '<f8', 'fortran_order': False, 'shape': ")
                .append(shape).append(", }");
        int preamble = MAGIC.length + 2 + 2;
        int total = preamble + dict.length() + 1;
        int padding = (HEADER_ALIGNMENT - total % HEADER_ALIGNMENT) % HEADER_ALIGNMENT;
        dict.append(" ".repeat(padding)).append('\n');

        out.write(MAGIC);
        out.write(1);
        out.write(0);
        int length = dict.length();
        out.write(length & 0xFF);
        out.write((length >>> 8) & 0xFF);
        out.write(dict.toString().getBytes(StandardCharsets.ISO_8859_1));
    }

    private static void writeDoubles(OutputStream out, double[] values) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(8 * 1024).order(ByteOrder.LITTLE_ENDIAN);
        for (double v : values) {
            if (!buffer.hasRemaining()) {
                out.write(buffer.array(), 0, buffer.position());
                buffer.clear();
            }
            buffer.putDouble(v);
        }
        out.write(buffer.array(), 0, buffer.position());
    }
}
