package com.bit.politeia.decred;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.crypto.DecredMessageVerifier;
import com.bit.politeia.crypto.ServerIdentity;
import com.bit.politeia.dcrdata.CommitmentAddressResolver;
import com.bit.politeia.decred.model.CastVote;
import com.bit.politeia.decred.model.CastVoteReply;
import com.bit.politeia.decred.model.VoteStatus;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.LedgerCorruptException;
import com.bit.politeia.exception.OracleUnavailableException;
import com.bit.politeia.exception.PoliteiaException;
import com.bit.politeia.ledger.DedupIndex;
import com.bit.politeia.ledger.LedgerHandle;
import com.bit.politeia.ledger.StorageLock;
import com.bit.politeia.ledger.VoteLedger;
import com.bit.politeia.util.TokenUtils;
import com.google.common.base.Stopwatch;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.bouncycastle.util.encoders.Base64;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * 投票接收流水线：
 * 解码 -> 批内去重 -> 验签（并行，不持锁）-> 获取写锁 -> 按提案重放账本去重 -> 追加并反签。
 * 每张票独立给出结果，顺序与输入一致；只有解码失败、获取锁失败、后端关闭会使整个调用失败。
 */
@Slf4j
@Component
public class CastVoteProcessor {

    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");
    // 票标识会拼进 dcrdata 路径
    private static final Pattern TICKET_ID = Pattern.compile("^[0-9a-zA-Z]+$");

    private final DecredPluginCodec codec;
    private final CommitmentAddressResolver commitmentResolver;
    private final DecredMessageVerifier messageVerifier;
    private final VoteLedger voteLedger;
    private final StorageLock storageLock;
    private final ServerIdentity identity;
    private final PoliteiaProperties properties;

    // 验签线程池：验签与 dcrdata 查询不触及共享状态，可以并行
    private ExecutorService verifyExecutor;

    @Autowired
    public CastVoteProcessor(DecredPluginCodec codec, CommitmentAddressResolver commitmentResolver,
                             DecredMessageVerifier messageVerifier, VoteLedger voteLedger,
                             StorageLock storageLock, ServerIdentity identity, PoliteiaProperties properties) {
        this.codec = codec;
        this.commitmentResolver = commitmentResolver;
        this.messageVerifier = messageVerifier;
        this.voteLedger = voteLedger;
        this.storageLock = storageLock;
        this.identity = identity;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        int threads = Math.max(1, properties.getVerifyThreads());
        verifyExecutor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10_000),
                new ThreadFactory() {
                    private final AtomicInteger seq = new AtomicInteger(0);

                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r, "vote-verify-" + seq.getAndIncrement());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy() // 拒绝由 submitValidation 处理
        );
        log.info("投票验签线程池初始化完成，线程数: {}", threads);
    }

    @PreDestroy
    public void shutdown() {
        if (verifyExecutor != null) {
            verifyExecutor.shutdown();
        }
    }

    /**
     * @param payload JSON 编码的 CastVote 数组
     * @return JSON 编码的 CastVoteReply 数组，与输入一一对应
     */
    public String castVotes(String payload) {
        return codec.encode(castVotes(codec.decodeCastVotes(payload)));
    }

    public List<CastVoteReply> castVotes(List<CastVote> votes) {
        if (storageLock.isShutdown()) {
            throw new PoliteiaException(ErrorType.SHUTDOWN_IN_PROGRESS, "后端正在关闭，拒绝处理投票");
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        int n = votes.size();
        CastVoteReply[] replies = new CastVoteReply[n];
        boolean[] decided = new boolean[n];

        // 1. 批内去重在验签之前，避免重复的密码学计算
        Set<String> seen = new HashSet<>();
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            CastVote vote = votes.get(i);
            replies[i] = new CastVoteReply();
            if (vote == null) {
                reject(replies, decided, i, VoteStatus.MALFORMED_VOTE, "empty vote");
                continue;
            }
            replies[i].setClientSignature(vote.getSignature());
            if (!seen.add(DedupIndex.key(vote.getToken(), vote.getTicket()))) {
                reject(replies, decided, i, VoteStatus.DUPLICATE_IN_BATCH,
                        "duplicate vote token " + vote.getToken() + " ticket " + vote.getTicket());
                continue;
            }
            String malformed = checkStructure(vote);
            if (malformed != null) {
                reject(replies, decided, i, VoteStatus.MALFORMED_VOTE, malformed);
                continue;
            }
            candidates.add(i);
        }

        // 2. 并行验签
        List<CompletableFuture<Rejection>> futures = new ArrayList<>(candidates.size());
        for (Integer i : candidates) {
            CastVote vote = votes.get(i);
            futures.add(submitValidation(vote));
        }
        List<Integer> verified = new ArrayList<>();
        for (int k = 0; k < candidates.size(); k++) {
            int i = candidates.get(k);
            Rejection rejection = futures.get(k).join();
            if (rejection != null) {
                reject(replies, decided, i, rejection.status, rejection.message);
            } else {
                verified.add(i);
            }
        }

        // 3. 持锁写账本；没有通过验签的票时不需要触碰存储
        if (!verified.isEmpty()) {
            try (StorageLock.Handle ignored = storageLock.acquire(properties.getLockTimeout())) {
                Map<String, List<Integer>> byToken = new LinkedHashMap<>();
                for (Integer i : verified) {
                    byToken.computeIfAbsent(votes.get(i).getToken(), t -> new ArrayList<>()).add(i);
                }
                for (Map.Entry<String, List<Integer>> entry : byToken.entrySet()) {
                    storeTokenVotes(entry.getKey(), entry.getValue(), votes, replies, decided);
                }
            }
        }

        int accepted = 0;
        for (CastVoteReply reply : replies) {
            if (reply.getError() == null) {
                accepted++;
            }
        }
        log.info("castvotes 完成 总数={} 接受={} 拒绝={} 耗时={}", n, accepted, n - accepted, stopwatch);
        return Arrays.asList(replies);
    }

    private CompletableFuture<Rejection> submitValidation(CastVote vote) {
        try {
            return CompletableFuture.supplyAsync(() -> validateVote(vote), verifyExecutor);
        } catch (RejectedExecutionException e) {
            if (verifyExecutor.isShutdown()) {
                throw new PoliteiaException(ErrorType.SHUTDOWN_IN_PROGRESS, "验签线程池已关闭", e);
            }
            // 队列满时调用方自己验签
            return CompletableFuture.completedFuture(validateVote(vote));
        }
    }

    /**
     * 单个提案：打开账本、重放去重、逐票追加。
     * 账本损坏或IO失败只影响该提案剩余的票，不中断其他提案
     */
    private void storeTokenVotes(String token, List<Integer> indexes, List<CastVote> votes,
                                 CastVoteReply[] replies, boolean[] decided) {
        try (LedgerHandle ledger = voteLedger.open(token)) {
            DedupIndex index = ledger.replay();
            for (Integer i : indexes) {
                CastVote vote = votes.get(i);
                if (index.contains(vote.getToken(), vote.getTicket())) {
                    log.debug("duplicate vote token {} ticket {}", vote.getToken(), vote.getTicket());
                    reject(replies, decided, i, VoteStatus.ALREADY_VOTED, VoteStatus.ALREADY_VOTED.getMessage());
                    continue;
                }
                byte[] counterSignature = identity.signMessage(vote.getSignature().getBytes(StandardCharsets.UTF_8));
                ledger.append(vote);
                index.add(vote.getToken(), vote.getTicket());
                replies[i].setSignature(Hex.encodeHexString(counterSignature));
                decided[i] = true;
            }
        } catch (LedgerCorruptException e) {
            log.error("投票账本损坏，停止处理该提案的投票，需人工介入: {}", e.getMessage(), e);
            failRemaining(token, indexes, replies, decided, e);
        } catch (PoliteiaException e) {
            log.warn("提案账本不可用 token={}: {}", token, e.getMessage());
            failRemaining(token, indexes, replies, decided, e);
        }
    }

    private void failRemaining(String token, List<Integer> indexes, CastVoteReply[] replies, boolean[] decided,
                               PoliteiaException cause) {
        for (Integer i : indexes) {
            if (!decided[i]) {
                reject(replies, decided, i, VoteStatus.TOKEN_FAILED,
                        VoteStatus.TOKEN_FAILED.getMessage() + " " + token + ": " + cause.getErrorType());
            }
        }
    }

    /**
     * 验证投票签名：期望签名者为票的最大承诺地址，消息为 token+ticket+votebit
     * @return 通过返回 null
     */
    private Rejection validateVote(CastVote vote) {
        String address;
        try {
            address = commitmentResolver.largestCommitmentAddress(vote.getTicket());
        } catch (OracleUnavailableException e) {
            log.debug("解析承诺地址失败 ticket={}: {}", vote.getTicket(), e.getMessage());
            return new Rejection(VoteStatus.ORACLE_ERROR, VoteStatus.ORACLE_ERROR.getMessage() + ": " + vote.getTicket());
        }

        byte[] sig;
        try {
            sig = Hex.decodeHex(vote.getSignature());
        } catch (DecoderException e) {
            return new Rejection(VoteStatus.INVALID_SIGNATURE, "invalid signature encoding");
        }

        try {
            boolean matched = messageVerifier.verifyMessage(address, vote.signedMessage(), Base64.toBase64String(sig));
            if (!matched) {
                return new Rejection(VoteStatus.INVALID_SIGNATURE, VoteStatus.INVALID_SIGNATURE.getMessage());
            }
        } catch (PoliteiaException e) {
            // 承诺地址不是 P2PKH 等输入错误
            return new Rejection(VoteStatus.INVALID_SIGNATURE, VoteStatus.INVALID_SIGNATURE.getMessage()
                    + ": " + e.getErrorType());
        }
        return null;
    }

    private static String checkStructure(CastVote vote) {
        if (!TokenUtils.isHexKey(vote.getToken())) {
            return "invalid token " + vote.getToken();
        }
        if (vote.getTicket() == null || !TICKET_ID.matcher(vote.getTicket()).matches()) {
            return "invalid ticket " + vote.getTicket();
        }
        if (vote.getVoteBit() == null || !HEX.matcher(vote.getVoteBit()).matches()) {
            return "invalid votebit " + vote.getVoteBit();
        }
        if (vote.getSignature() == null || vote.getSignature().isEmpty()) {
            return "missing signature";
        }
        return null;
    }

    private static void reject(CastVoteReply[] replies, boolean[] decided, int i, VoteStatus status, String message) {
        replies[i].setError(message);
        replies[i].setErrorStatus(status);
        replies[i].setSignature(null);
        decided[i] = true;
    }

    private static class Rejection {
        final VoteStatus status;
        final String message;

        Rejection(VoteStatus status, String message) {
            this.status = status;
            this.message = message;
        }
    }
}
