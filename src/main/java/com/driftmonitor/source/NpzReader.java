package com.driftmonitor.source;

import com.driftmonitor.exception.MalformedDataException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Reads NumPy {@code .npz} archives: a zip of {@code .npy} members, one per key.
 * Numeric members are widened to {@code double}.
 */
public final class NpzReader {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([<>|=])([fiu])(\\d+)'");
    private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

    private NpzReader() {}

    public static Map<String, NpyArray> read(Path archive) throws IOException {
        Map<String, NpyArray> arrays = new LinkedHashMap<>();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            var entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory() || !entry.getName().endsWith(".npy")) {
                    continue;
                }
                String key = entry.getName().substring(0, entry.getName().length() - ".npy".length());
                try (InputStream in = zip.getInputStream(entry)) {
                    arrays.put(key, readNpy(key, in.readAllBytes()));
                }
            }
        } catch (ZipException ex) {
            throw new MalformedDataException("'" + archive.getFileName() + "' is not a valid npz archive", ex);
        }
        return arrays;
    }

    static NpyArray readNpy(String key, byte[] bytes) {
        if (bytes.length < 10 || !Arrays.equals(Arrays.copyOf(bytes, MAGIC.length), MAGIC)) {
            throw new MalformedDataException("npz member '" + key + "' is not a .npy array");
        }
        int major = bytes[6] & 0xFF;
        ByteBuffer header = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int headerLen;
        int dataOffset;
        if (major == 1) {
            headerLen = header.getShort(8) & 0xFFFF;
            dataOffset = 10 + headerLen;
        } else if (major == 2 || major == 3) {
            headerLen = header.getInt(8);
            dataOffset = 12 + headerLen;
        } else {
            throw new MalformedDataException("npz member '" + key + "' has unsupported .npy version " + major);
        }
        if (dataOffset > bytes.length) {
            throw new MalformedDataException("npz member '" + key + "' header is truncated");
        }
        String dict = new String(bytes, dataOffset - headerLen, headerLen, StandardCharsets.ISO_8859_1);

        Matcher descr = DESCR.matcher(dict);
        Matcher fortran = FORTRAN.matcher(dict);
        Matcher shapeMatch = SHAPE.matcher(dict);
        if (!descr.find() || !fortran.find() || !shapeMatch.find()) {
            throw new MalformedDataException("npz member '" + key + "' has an unreadable header: " + dict.trim());
        }
        if ("True".equals(fortran.group(1))) {
            throw new MalformedDataException("npz member '" + key + "' is Fortran-ordered");
        }
        int[] shape = parseShape(key, shapeMatch.group(1));
        ByteOrder order = ">".equals(descr.group(1)) ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        char kind = descr.group(2).charAt(0);
        int width = Integer.parseInt(descr.group(3));

        int count = 1;
        for (int d : shape) {
            count *= d;
        }
        if ((long) count * width > bytes.length - dataOffset) {
            throw new MalformedDataException("npz member '" + key + "' is shorter than its declared shape");
        }
        ByteBuffer data = ByteBuffer.wrap(bytes, dataOffset, bytes.length - dataOffset).slice().order(order);
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = readElement(key, data, kind, width);
        }
        return new NpyArray(shape, values);
    }

    private static double readElement(String key, ByteBuffer data, char kind, int width) {
        switch (kind) {
            case 'f':
                if (width == 8) return data.getDouble();
                if (width == 4) return data.getFloat();
                break;
            case 'i':
                if (width == 8) return data.getLong();
                if (width == 4) return data.getInt();
                if (width == 1) return data.get();
                break;
            case 'u':
                if (width == 1) return data.get() & 0xFF;
                if (width == 4) return data.getInt() & 0xFFFFFFFFL;
                break;
            default:
                break;
        }
        throw new MalformedDataException("npz member '" + key + "' has unsupported dtype " + kind + width);
    }

    private static int[] parseShape(String key, String raw) {
        String[] parts = raw.split(",");
        return Arrays.stream(parts)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .mapToInt(s -> {
                try {
                    return Integer.parseInt(s.endsWith("L") ? s.substring(0, s.length() - 1) : s);
                } catch (NumberFormatException ex) {
                    throw new MalformedDataException("npz member '" + key + "' has invalid shape (" + raw + ")", ex);
                }
            })
            .toArray();
    }

    public record NpyArray(int[] shape, double[] values) {

        public int rank() {
            return shape.length;
        }

        public double[] row(int i) {
            int cols = shape[1];
            return Arrays.copyOfRange(values, i * cols, (i + 1) * cols);
        }
    }
}
