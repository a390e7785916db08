package com.bit.politeia.decred;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.decred.model.StartVoteReply;
import com.bit.politeia.decred.model.Vote;
import com.bit.politeia.decred.model.VoteOption;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import com.bit.politeia.ledger.StorageLock;
import com.bit.politeia.record.MetadataStream;
import com.bit.politeia.record.RecordStore;
import com.bit.politeia.util.TokenUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 开启提案投票：生成选民快照，把投票位定义与会话描述作为两条元数据流原子地写入提案记录
 */
@Slf4j
@Component
public class VoteSessionManager {

    private final DecredPluginCodec codec;
    private final TicketSnapshotter snapshotter;
    private final RecordStore recordStore;
    private final StorageLock storageLock;
    private final PoliteiaProperties properties;

    @Autowired
    public VoteSessionManager(DecredPluginCodec codec, TicketSnapshotter snapshotter, RecordStore recordStore,
                              StorageLock storageLock, PoliteiaProperties properties) {
        this.codec = codec;
        this.snapshotter = snapshotter;
        this.recordStore = recordStore;
        this.storageLock = storageLock;
        this.properties = properties;
    }

    /**
     * @param payload JSON 编码的 {@link Vote}
     * @return JSON 编码的 {@link StartVoteReply}
     */
    public String startVote(String payload) {
        Vote vote = codec.decodeVote(payload);
        TokenUtils.convertStringToken(vote.getToken());
        validateVoteBits(vote);

        // 先检查一次，避免为已开始的投票做无用的链查询
        ensureNotStarted(vote.getToken());

        TicketSnapshot snapshot = snapshotter.computeSnapshot();
        StartVoteReply reply = new StartVoteReply(
                Long.toString(snapshot.getBlockHeight()),
                snapshot.getBlockHash(),
                Long.toString(snapshot.getBlockHeight() + properties.getVoteDuration()),
                snapshot.getTickets());
        String encoded = codec.encode(reply);

        try (StorageLock.Handle ignored = storageLock.acquire(properties.getLockTimeout())) {
            // 持锁后再检查，并发的 startvote 只有一个能写入
            ensureNotStarted(vote.getToken());
            recordStore.updateVettedMetadata(vote.getToken(), null, List.of(
                    new MetadataStream(DecredPlugin.MD_STREAM_VOTE_BITS, payload),
                    new MetadataStream(DecredPlugin.MD_STREAM_VOTE_SNAPSHOT, encoded)));
        }

        log.info("Vote started for: {} snapshot {} start {} end {} tickets {}",
                vote.getToken(), reply.getStartBlockHash(), reply.getStartBlockHeight(),
                reply.getEndHeight(), reply.getEligibleTickets().size());
        return encoded;
    }

    private void ensureNotStarted(String token) {
        Map<Integer, String> streams = recordStore.getVettedMetadata(token);
        if (streams.containsKey(DecredPlugin.MD_STREAM_VOTE_SNAPSHOT)) {
            throw new PoliteiaException(ErrorType.VOTE_ALREADY_STARTED, "提案投票已开始: " + token);
        }
    }

    /**
     * 投票位检查：掩码非零，至少一个选项，每个选项的位非零、落在掩码内且互不相同
     */
    static void validateVoteBits(Vote vote) {
        if (vote.getMask() == 0) {
            throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, "投票位掩码为0");
        }
        if (vote.getOptions() == null || vote.getOptions().isEmpty()) {
            throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, "缺少投票选项");
        }
        Set<Long> seen = new HashSet<>();
        for (VoteOption option : vote.getOptions()) {
            long bits = option.getBits();
            if (bits == 0 || (bits & ~vote.getMask()) != 0) {
                throw new PoliteiaException(ErrorType.MALFORMED_REQUEST,
                        "选项 " + option.getId() + " 的投票位 " + Long.toHexString(bits) + " 不在掩码内");
            }
            if (!seen.add(bits)) {
                throw new PoliteiaException(ErrorType.MALFORMED_REQUEST,
                        "选项 " + option.getId() + " 的投票位重复");
            }
        }
    }
}
