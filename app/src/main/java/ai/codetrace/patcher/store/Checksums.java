package ai.codetrace.patcher.store;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * CRC32 helpers; text is always hashed as UTF-8 bytes.
 */
public final class Checksums {

    private Checksums() {
    }

    public static long crc32(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return crc32(bytes, 0, bytes.length);
    }

    public static long crc32(byte[] content, int offset, int length) {
        CRC32 crc = new CRC32();
        crc.update(content, offset, length);
        return crc.getValue();
    }

    public static String toHex(long checksum) {
        return String.format("%08x", checksum);
    }
}
