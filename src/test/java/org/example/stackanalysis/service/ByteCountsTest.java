package org.example.stackanalysis.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ByteCountsTest {

    @Test
    void format() {
        assertEquals("0 Bytes", ByteCounts.format(0));
        assertEquals("1 Byte", ByteCounts.format(1));
        assertEquals("1023 Bytes", ByteCounts.format(1023));
        assertEquals("1 Kilobyte", ByteCounts.format(1024));
        assertEquals("1 Kilobyte, 512 Bytes", ByteCounts.format(1536));
        assertEquals("1 Megabyte, 200 Kilobytes", ByteCounts.format(1024 * 1024 + 200 * 1024));
        assertEquals("2 Gigabytes, 1 Byte", ByteCounts.format(2L * 1024 * 1024 * 1024 + 1));
        assertEquals("-2 Kilobytes", ByteCounts.format(-2048));
    }
}
