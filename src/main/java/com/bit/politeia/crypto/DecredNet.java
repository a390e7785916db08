package com.bit.politeia.crypto;

/**
 * Decred 网络参数：地址前缀（2字节 netID）、票成熟区块数、默认 dcrdata 地址
 */
public enum DecredNet {
    // netID: P2PKH, P2SH, P2PK, P2PKH-Edwards, P2PKH-Schnorr
    MAINNET(0x073f, 0x071a, 0x1386, 0x071f, 0x0701, 256, "https://dcrdata.org:443/"),
    TESTNET3(0x0f21, 0x0efc, 0x28f7, 0x0f01, 0x0ee3, 16, "https://testnet.dcrdata.org:443/"),
    SIMNET(0x0e91, 0x0e6c, 0x276f, 0x0e71, 0x0e53, 16, "http://127.0.0.1:7777/"),
    REGNET(0x0e00, 0x0ddb, 0x25e5, 0x0de0, 0x0dc2, 16, "http://127.0.0.1:7777/");

    private final int pubKeyHashAddrId;
    private final int scriptHashAddrId;
    private final int pubKeyAddrId;
    private final int pkhEdwardsAddrId;
    private final int pkhSchnorrAddrId;
    private final int ticketMaturity;
    private final String defaultDcrdataUrl;

    DecredNet(int pubKeyHashAddrId, int scriptHashAddrId, int pubKeyAddrId,
              int pkhEdwardsAddrId, int pkhSchnorrAddrId, int ticketMaturity, String defaultDcrdataUrl) {
        this.pubKeyHashAddrId = pubKeyHashAddrId;
        this.scriptHashAddrId = scriptHashAddrId;
        this.pubKeyAddrId = pubKeyAddrId;
        this.pkhEdwardsAddrId = pkhEdwardsAddrId;
        this.pkhSchnorrAddrId = pkhSchnorrAddrId;
        this.ticketMaturity = ticketMaturity;
        this.defaultDcrdataUrl = defaultDcrdataUrl;
    }

    public int getPubKeyHashAddrId() {
        return pubKeyHashAddrId;
    }

    public int getTicketMaturity() {
        return ticketMaturity;
    }

    public String getDefaultDcrdataUrl() {
        return defaultDcrdataUrl;
    }

    /**
     * netID 是否属于本网络的某种已知地址类型
     */
    public boolean isKnownAddrId(int netId) {
        return netId == pubKeyHashAddrId
                || netId == scriptHashAddrId
                || netId == pubKeyAddrId
                || netId == pkhEdwardsAddrId
                || netId == pkhSchnorrAddrId;
    }

    /**
     * 按 netID 查找所属网络，未知返回 null
     */
    public static DecredNet fromAddrId(int netId) {
        for (DecredNet net : values()) {
            if (net.isKnownAddrId(netId)) {
                return net;
            }
        }
        return null;
    }
}
