package com.bit.politeia.util;

import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.regex.Pattern;

public class TokenUtils {

    /**
     * 提案令牌为 SHA-256 摘要，32字节
     */
    public static final int TOKEN_LENGTH = 32;

    private static final Pattern LOWER_HEX = Pattern.compile("^[0-9a-f]+$");

    private TokenUtils() {
    }

    /**
     * 令牌可以安全地作为目录名使用（非空小写 hex）
     */
    public static boolean isHexKey(String token) {
        return token != null && LOWER_HEX.matcher(token).matches();
    }

    /**
     * 解码并校验完整的提案令牌
     * @throws PoliteiaException MALFORMED_TOKEN
     */
    public static byte[] convertStringToken(String token) {
        if (!isHexKey(token)) {
            throw new PoliteiaException(ErrorType.MALFORMED_TOKEN, "令牌不是小写hex: " + token);
        }
        byte[] decoded;
        try {
            decoded = Hex.decodeHex(token);
        } catch (DecoderException e) {
            throw new PoliteiaException(ErrorType.MALFORMED_TOKEN, "令牌hex解码失败: " + token, e);
        }
        if (decoded.length != TOKEN_LENGTH) {
            throw new PoliteiaException(ErrorType.MALFORMED_TOKEN,
                    "令牌长度应为" + TOKEN_LENGTH + "字节，实际" + decoded.length);
        }
        return decoded;
    }
}
