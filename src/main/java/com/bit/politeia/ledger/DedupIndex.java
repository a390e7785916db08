package com.bit.politeia.ledger;

import java.util.HashSet;
import java.util.Set;

/**
 * 去重索引：(token, ticket) 键集合。每批投票前由账本重放重建，不跨调用缓存
 */
public class DedupIndex {

    private final Set<String> keys = new HashSet<>();

    public static String key(String token, String ticket) {
        return token + "/" + ticket;
    }

    public boolean contains(String token, String ticket) {
        return keys.contains(key(token, ticket));
    }

    /**
     * @return 键已存在时返回 false
     */
    public boolean add(String token, String ticket) {
        return keys.add(key(token, ticket));
    }

    public int size() {
        return keys.size();
    }
}
