package com.bit.politeia.decred;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.dcrdata.BlockDataBasic;
import com.bit.politeia.dcrdata.DcrdataClient;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.OracleUnavailableException;
import com.bit.politeia.exception.PoliteiaException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * 选民快照：从最佳高度回退票成熟区块数，进入不可分叉区间后取该区块的票池。
 * 任何观察者都可以用公开链数据独立重算同一快照。
 */
@Slf4j
@Component
public class TicketSnapshotter {

    private final DcrdataClient dcrdataClient;
    private final PoliteiaProperties properties;

    @Autowired
    public TicketSnapshotter(DcrdataClient dcrdataClient, PoliteiaProperties properties) {
        this.dcrdataClient = dcrdataClient;
        this.properties = properties;
    }

    public TicketSnapshot computeSnapshot() {
        return computeSnapshot(properties.resolveTicketMaturity());
    }

    /**
     * @param maturity 回退的区块数
     * @throws PoliteiaException CHAIN_TOO_YOUNG 最佳高度小于 maturity；ORACLE_UNAVAILABLE 查询失败
     */
    public TicketSnapshot computeSnapshot(int maturity) {
        BlockDataBasic best = dcrdataClient.bestBlock();
        if (best.getHeight() < maturity) {
            throw new PoliteiaException(ErrorType.CHAIN_TOO_YOUNG,
                    "最佳高度 " + best.getHeight() + " 小于票成熟区块数 " + maturity);
        }

        long snapshotHeight = best.getHeight() - maturity;
        BlockDataBasic snapshotBlock = dcrdataClient.block(snapshotHeight);
        if (snapshotBlock.getHeight() != snapshotHeight || snapshotBlock.getHash() == null) {
            throw new OracleUnavailableException("区块查询返回不一致: 请求高度 " + snapshotHeight
                    + " 返回高度 " + snapshotBlock.getHeight());
        }

        List<String> tickets = dcrdataClient.ticketPool(snapshotBlock.getHash());
        log.info("票池快照 高度={} 哈希={} 票数={}", snapshotHeight, snapshotBlock.getHash(), tickets.size());
        return new TicketSnapshot(snapshotHeight, snapshotBlock.getHash(), Collections.unmodifiableList(tickets));
    }
}
