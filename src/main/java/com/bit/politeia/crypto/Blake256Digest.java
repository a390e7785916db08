package com.bit.politeia.crypto;

import org.bouncycastle.crypto.Digest;

/**
 * BLAKE-256（14轮，SHA-3 最终轮版本），Decred 的链上哈希算法。
 * BouncyCastle 只提供 BLAKE2/BLAKE3，这里按 {@link Digest} 接口补齐。
 * 非线程安全，每个线程使用独立实例。
 */
public class Blake256Digest implements Digest {

    public static final int DIGEST_LENGTH = 32;

    private static final int BLOCK_LENGTH = 64;

    private static final int ROUNDS = 14;

    private static final int[] IV = {
            0x6A09E667, 0xBB67AE85, 0x3C6EF372, 0xA54FF53A,
            0x510E527F, 0x9B05688C, 0x1F83D9AB, 0x5BE0CD19
    };

    // 圆周率小数部分
    private static final int[] C = {
            0x243F6A88, 0x85A308D3, 0x13198A2E, 0x03707344,
            0xA4093822, 0x299F31D0, 0x082EFA98, 0xEC4E6C89,
            0x452821E6, 0x38D01377, 0xBE5466CF, 0x34E90C6C,
            0xC0AC29B7, 0xC97C50DD, 0x3F84D5B5, 0xB5470917
    };

    private static final int[][] SIGMA = {
            {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15},
            {14, 10, 4, 8, 9, 15, 13, 6, 1, 12, 0, 2, 11, 7, 5, 3},
            {11, 8, 12, 0, 5, 2, 15, 13, 10, 14, 3, 6, 7, 1, 9, 4},
            {7, 9, 3, 1, 13, 12, 11, 14, 2, 6, 5, 10, 4, 0, 15, 8},
            {9, 0, 5, 7, 2, 4, 10, 15, 14, 1, 11, 12, 6, 8, 3, 13},
            {2, 12, 6, 10, 0, 11, 8, 3, 4, 13, 7, 5, 15, 14, 1, 9},
            {12, 5, 1, 15, 14, 13, 4, 10, 0, 7, 6, 3, 9, 2, 8, 11},
            {13, 11, 7, 14, 12, 1, 3, 9, 5, 0, 15, 4, 8, 6, 2, 10},
            {6, 15, 14, 9, 11, 3, 0, 8, 12, 2, 13, 7, 1, 4, 10, 5},
            {10, 2, 8, 4, 7, 6, 1, 5, 15, 11, 9, 14, 3, 12, 13, 0}
    };

    private final int[] h = new int[8];
    private final int[] m = new int[16];
    private final int[] v = new int[16];
    private final byte[] buffer = new byte[BLOCK_LENGTH];
    private int bufferLength;
    // 已压缩的消息字节数
    private long processed;

    public Blake256Digest() {
        reset();
    }

    /**
     * 单次计算 BLAKE-256
     */
    public static byte[] hash(byte[] data) {
        Blake256Digest digest = new Blake256Digest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    @Override
    public String getAlgorithmName() {
        return "BLAKE-256";
    }

    @Override
    public int getDigestSize() {
        return DIGEST_LENGTH;
    }

    @Override
    public void update(byte in) {
        if (bufferLength == BLOCK_LENGTH) {
            processed += BLOCK_LENGTH;
            compress(buffer, 0, processed << 3);
            bufferLength = 0;
        }
        buffer[bufferLength++] = in;
    }

    @Override
    public void update(byte[] in, int inOff, int len) {
        while (len > 0) {
            if (bufferLength == BLOCK_LENGTH) {
                processed += BLOCK_LENGTH;
                compress(buffer, 0, processed << 3);
                bufferLength = 0;
            }
            int n = Math.min(len, BLOCK_LENGTH - bufferLength);
            System.arraycopy(in, inOff, buffer, bufferLength, n);
            bufferLength += n;
            inOff += n;
            len -= n;
        }
    }

    @Override
    public int doFinal(byte[] out, int outOff) {
        if (bufferLength == BLOCK_LENGTH) {
            processed += BLOCK_LENGTH;
            compress(buffer, 0, processed << 3);
            bufferLength = 0;
        }
        long totalBits = (processed + bufferLength) << 3;
        byte[] block = new byte[BLOCK_LENGTH];
        System.arraycopy(buffer, 0, block, 0, bufferLength);

        if (bufferLength <= 55) {
            // 填充与长度放在同一块；空块的计数器记为0
            block[bufferLength] = (byte) 0x80;
            block[55] |= 0x01;
            putLong(totalBits, block, 56);
            compress(block, 0, bufferLength == 0 ? 0 : totalBits);
        } else {
            block[bufferLength] = (byte) 0x80;
            compress(block, 0, totalBits);
            byte[] tail = new byte[BLOCK_LENGTH];
            tail[55] = 0x01;
            putLong(totalBits, tail, 56);
            compress(tail, 0, 0);
        }

        for (int i = 0; i < 8; i++) {
            putInt(h[i], out, outOff + i * 4);
        }
        reset();
        return DIGEST_LENGTH;
    }

    @Override
    public void reset() {
        System.arraycopy(IV, 0, h, 0, 8);
        bufferLength = 0;
        processed = 0;
    }

    private void compress(byte[] block, int off, long counter) {
        for (int i = 0; i < 16; i++) {
            m[i] = getInt(block, off + i * 4);
        }
        int t0 = (int) counter;
        int t1 = (int) (counter >>> 32);

        System.arraycopy(h, 0, v, 0, 8);
        v[8] = C[0];
        v[9] = C[1];
        v[10] = C[2];
        v[11] = C[3];
        v[12] = t0 ^ C[4];
        v[13] = t0 ^ C[5];
        v[14] = t1 ^ C[6];
        v[15] = t1 ^ C[7];

        for (int r = 0; r < ROUNDS; r++) {
            int[] s = SIGMA[r % 10];
            g(s, 0, 0, 4, 8, 12);
            g(s, 1, 1, 5, 9, 13);
            g(s, 2, 2, 6, 10, 14);
            g(s, 3, 3, 7, 11, 15);
            g(s, 4, 0, 5, 10, 15);
            g(s, 5, 1, 6, 11, 12);
            g(s, 6, 2, 7, 8, 13);
            g(s, 7, 3, 4, 9, 14);
        }

        // 盐值为0，终结步骤只需异或 v 的两半
        for (int i = 0; i < 8; i++) {
            h[i] ^= v[i] ^ v[i + 8];
        }
    }

    private void g(int[] s, int i, int a, int b, int c, int d) {
        int j = s[2 * i];
        int k = s[2 * i + 1];
        v[a] += v[b] + (m[j] ^ C[k]);
        v[d] = Integer.rotateRight(v[d] ^ v[a], 16);
        v[c] += v[d];
        v[b] = Integer.rotateRight(v[b] ^ v[c], 12);
        v[a] += v[b] + (m[k] ^ C[j]);
        v[d] = Integer.rotateRight(v[d] ^ v[a], 8);
        v[c] += v[d];
        v[b] = Integer.rotateRight(v[b] ^ v[c], 7);
    }

    private static int getInt(byte[] b, int off) {
        return ((b[off] & 0xff) << 24)
                | ((b[off + 1] & 0xff) << 16)
                | ((b[off + 2] & 0xff) << 8)
                | (b[off + 3] & 0xff);
    }

    private static void putInt(int value, byte[] b, int off) {
        b[off] = (byte) (value >>> 24);
        b[off + 1] = (byte) (value >>> 16);
        b[off + 2] = (byte) (value >>> 8);
        b[off + 3] = (byte) value;
    }

    private static void putLong(long value, byte[] b, int off) {
        putInt((int) (value >>> 32), b, off);
        putInt((int) value, b, off + 4);
    }
}
