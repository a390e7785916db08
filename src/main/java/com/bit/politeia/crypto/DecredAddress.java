package com.bit.politeia.crypto;

import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import lombok.Getter;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;
import org.bouncycastle.crypto.digests.RIPEMD160Digest;

import java.util.Arrays;

/**
 * Decred P2PKH 地址：base58(netID[2] || hash160[20] || checksum[4])
 * hash160 = RIPEMD160(BLAKE256(pubkey))，checksum = BLAKE256(BLAKE256(netID || hash160)) 前4字节
 */
@Getter
public class DecredAddress {

    public static final int HASH160_LENGTH = 20;
    private static final int NET_ID_LENGTH = 2;
    private static final int CHECKSUM_LENGTH = 4;
    private static final int P2PKH_DECODED_LENGTH = NET_ID_LENGTH + HASH160_LENGTH + CHECKSUM_LENGTH;

    private final DecredNet net;
    private final byte[] pubKeyHash;

    private DecredAddress(DecredNet net, byte[] pubKeyHash) {
        this.net = net;
        this.pubKeyHash = pubKeyHash;
    }

    /**
     * 由序列化公钥（压缩33字节或非压缩65字节）生成 P2PKH 地址
     */
    public static DecredAddress fromPubKey(byte[] serializedPubKey, DecredNet net) {
        return new DecredAddress(net, hash160(serializedPubKey));
    }

    /**
     * 解码地址，只接受签名所需的 P2PKH 类型
     * @throws PoliteiaException INVALID_ADDRESS 格式错误、校验和不符或非P2PKH
     */
    public static DecredAddress decode(String address) {
        if (address == null || address.isEmpty()) {
            throw new PoliteiaException(ErrorType.INVALID_ADDRESS, "地址为空");
        }
        byte[] decoded;
        try {
            decoded = Base58.decode(address);
        } catch (AddressFormatException e) {
            throw new PoliteiaException(ErrorType.INVALID_ADDRESS, "Base58解码失败: " + address, e);
        }
        if (decoded.length <= NET_ID_LENGTH + CHECKSUM_LENGTH) {
            throw new PoliteiaException(ErrorType.INVALID_ADDRESS, "地址长度错误: " + address);
        }

        int payloadLength = decoded.length - CHECKSUM_LENGTH;
        byte[] expected = checksum(Arrays.copyOfRange(decoded, 0, payloadLength));
        byte[] actual = Arrays.copyOfRange(decoded, payloadLength, decoded.length);
        if (!Arrays.equals(expected, actual)) {
            throw new PoliteiaException(ErrorType.INVALID_ADDRESS, "地址校验和不匹配: " + address);
        }

        int netId = ((decoded[0] & 0xff) << 8) | (decoded[1] & 0xff);
        DecredNet net = DecredNet.fromAddrId(netId);
        if (net == null) {
            throw new PoliteiaException(ErrorType.INVALID_ADDRESS, "未知的地址网络前缀: " + address);
        }
        if (netId != net.getPubKeyHashAddrId()) {
            throw new PoliteiaException(ErrorType.INVALID_ADDRESS, "不是 pay-to-pubkey-hash 地址: " + address);
        }
        if (decoded.length != P2PKH_DECODED_LENGTH) {
            throw new PoliteiaException(ErrorType.INVALID_ADDRESS, "P2PKH 地址长度错误: " + address);
        }
        return new DecredAddress(net, Arrays.copyOfRange(decoded, NET_ID_LENGTH, NET_ID_LENGTH + HASH160_LENGTH));
    }

    public String encode() {
        byte[] payload = new byte[NET_ID_LENGTH + HASH160_LENGTH];
        int netId = net.getPubKeyHashAddrId();
        payload[0] = (byte) (netId >>> 8);
        payload[1] = (byte) netId;
        System.arraycopy(pubKeyHash, 0, payload, NET_ID_LENGTH, HASH160_LENGTH);

        byte[] full = new byte[P2PKH_DECODED_LENGTH];
        System.arraycopy(payload, 0, full, 0, payload.length);
        System.arraycopy(checksum(payload), 0, full, payload.length, CHECKSUM_LENGTH);
        return Base58.encode(full);
    }

    public static byte[] hash160(byte[] data) {
        byte[] blake = Blake256Digest.hash(data);
        RIPEMD160Digest ripemd = new RIPEMD160Digest();
        ripemd.update(blake, 0, blake.length);
        byte[] out = new byte[ripemd.getDigestSize()];
        ripemd.doFinal(out, 0);
        return out;
    }

    private static byte[] checksum(byte[] payload) {
        byte[] doubleHash = Blake256Digest.hash(Blake256Digest.hash(payload));
        return Arrays.copyOf(doubleHash, CHECKSUM_LENGTH);
    }

    @Override
    public String toString() {
        return encode();
    }
}
