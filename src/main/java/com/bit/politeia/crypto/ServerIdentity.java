package com.bit.politeia.crypto;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;

/**
 * 服务签名身份：长期 Ed25519 密钥对，仅用于对已接受投票的客户端签名做反签。
 * 首次启动生成并保存到 identity.json，公钥通过 /v1/identity 对外公布。
 */
@Slf4j
@Component
public class ServerIdentity {
    // 底层签名器无状态，按线程复用
    private static final ThreadLocal<Ed25519Signer> SIGNER_THREAD_LOCAL = ThreadLocal.withInitial(Ed25519Signer::new);
    private static final ThreadLocal<Ed25519Signer> VERIFIER_THREAD_LOCAL = ThreadLocal.withInitial(Ed25519Signer::new);

    public static final int SIGNATURE_LENGTH = 64;

    private final PoliteiaProperties properties;
    private final ObjectMapper objectMapper;

    private Ed25519PrivateKeyParameters privateKey;
    private byte[] publicKey;

    @Autowired
    public ServerIdentity(PoliteiaProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        Path file = properties.identityFile();
        try {
            if (Files.exists(file)) {
                IdentityFile stored = objectMapper.readValue(file.toFile(), IdentityFile.class);
                privateKey = new Ed25519PrivateKeyParameters(Hex.decode(stored.getPrivateKey()), 0);
                publicKey = privateKey.generatePublicKey().getEncoded();
                if (stored.getPublicKey() != null && !stored.getPublicKey().equalsIgnoreCase(getPublicKeyHex())) {
                    throw new PoliteiaException(ErrorType.IDENTITY_UNAVAILABLE, "身份文件公私钥不匹配: " + file);
                }
                log.info("加载服务签名身份 {}，公钥: {}", file, getPublicKeyHex());
            } else {
                privateKey = new Ed25519PrivateKeyParameters(new SecureRandom());
                publicKey = privateKey.generatePublicKey().getEncoded();
                save(file);
                log.info("生成新的服务签名身份 {}，公钥: {}", file, getPublicKeyHex());
            }
        } catch (IOException e) {
            throw new PoliteiaException(ErrorType.IDENTITY_UNAVAILABLE, "读写身份文件失败: " + file, e);
        }
    }

    /**
     * 对消息签名，返回64字节 Ed25519 签名
     */
    public byte[] signMessage(byte[] message) {
        if (privateKey == null) {
            throw new PoliteiaException(ErrorType.IDENTITY_UNAVAILABLE, "服务签名身份未初始化");
        }
        Ed25519Signer signer = SIGNER_THREAD_LOCAL.get();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    public String getPublicKeyHex() {
        return Hex.toHexString(publicKey);
    }

    /**
     * 外部验签：用公布的32字节公钥验证反签
     */
    public static boolean verify(byte[] publicKey, byte[] message, byte[] signature) {
        if (publicKey == null || publicKey.length != Ed25519PublicKeyParameters.KEY_SIZE
                || signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        Ed25519Signer verifier = VERIFIER_THREAD_LOCAL.get();
        verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }

    private void save(Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        IdentityFile stored = new IdentityFile();
        stored.setPublicKey(getPublicKeyHex());
        stored.setPrivateKey(Hex.toHexString(privateKey.getEncoded()));
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), stored);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Data
    @NoArgsConstructor
    public static class IdentityFile {
        private String publicKey;
        private String privateKey;
    }
}
