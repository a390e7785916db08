package com.bit.politeia.decred;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.decred.model.StartVoteReply;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import com.bit.politeia.ledger.StorageLock;
import com.bit.politeia.record.FileRecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class VoteSessionManagerTest {

    private static final String TOKEN = "0123456789abcdef".repeat(4);

    @TempDir
    Path dataDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private DecredPluginCodec codec;
    private TicketSnapshotter snapshotter;
    private FileRecordStore recordStore;
    private VoteSessionManager manager;

    @BeforeEach
    void setUp() throws Exception {
        PoliteiaProperties properties = new PoliteiaProperties();
        properties.setDataDir(dataDir.toString());
        Files.createDirectories(properties.vettedDir().resolve(TOKEN));

        codec = new DecredPluginCodec(mapper);
        snapshotter = mock(TicketSnapshotter.class);
        recordStore = new FileRecordStore(properties, mapper);
        manager = new VoteSessionManager(codec, snapshotter, recordStore, new StorageLock(), properties);
    }

    private static String startVotePayload(String token, long mask, long yesBits, long noBits) {
        return "{\"token\":\"" + token + "\",\"mask\":" + mask + ",\"options\":["
                + "{\"id\":\"no\",\"description\":\"Don't approve proposal\",\"bits\":" + noBits + "},"
                + "{\"id\":\"yes\",\"description\":\"Approve proposal\",\"bits\":" + yesBits + "}]}";
    }

    @Test
    void startVoteWritesBothStreams() {
        when(snapshotter.computeSnapshot()).thenReturn(new TicketSnapshot(299744, "h299744", List.of("t1", "t2")));
        String payload = startVotePayload(TOKEN, 3, 2, 1);

        StartVoteReply reply = codec.decodeStartVoteReply(manager.startVote(payload));
        assertEquals("299744", reply.getStartBlockHeight());
        assertEquals("h299744", reply.getStartBlockHash());
        assertEquals("301760", reply.getEndHeight());
        assertEquals(List.of("t1", "t2"), reply.getEligibleTickets());

        Map<Integer, String> streams = recordStore.getVettedMetadata(TOKEN);
        assertEquals(payload, streams.get(DecredPlugin.MD_STREAM_VOTE_BITS));
        assertEquals(reply, codec.decodeStartVoteReply(streams.get(DecredPlugin.MD_STREAM_VOTE_SNAPSHOT)));
    }

    @Test
    void secondStartVoteIsRejected() {
        when(snapshotter.computeSnapshot()).thenReturn(new TicketSnapshot(100, "h100", List.of("t1")));
        String payload = startVotePayload(TOKEN, 3, 2, 1);
        String first = manager.startVote(payload);

        PoliteiaException e = assertThrows(PoliteiaException.class, () -> manager.startVote(payload));
        assertEquals(ErrorType.VOTE_ALREADY_STARTED, e.getErrorType());
        verify(snapshotter, times(1)).computeSnapshot();
        assertEquals(first, recordStore.getVettedMetadata(TOKEN).get(DecredPlugin.MD_STREAM_VOTE_SNAPSHOT));
    }

    @Test
    void malformedPayloads() {
        assertEquals(ErrorType.MALFORMED_REQUEST,
                assertThrows(PoliteiaException.class, () -> manager.startVote("{not json")).getErrorType());
        assertEquals(ErrorType.MALFORMED_TOKEN,
                assertThrows(PoliteiaException.class, () -> manager.startVote(startVotePayload("abc", 3, 2, 1))).getErrorType());
        // 选项位超出掩码
        assertEquals(ErrorType.MALFORMED_REQUEST,
                assertThrows(PoliteiaException.class, () -> manager.startVote(startVotePayload(TOKEN, 1, 2, 1))).getErrorType());
        // 选项位重复
        assertEquals(ErrorType.MALFORMED_REQUEST,
                assertThrows(PoliteiaException.class, () -> manager.startVote(startVotePayload(TOKEN, 3, 1, 1))).getErrorType());
        verify(snapshotter, never()).computeSnapshot();
    }

    @Test
    void unknownRecord() {
        String other = "f".repeat(64);
        PoliteiaException e = assertThrows(PoliteiaException.class,
                () -> manager.startVote(startVotePayload(other, 3, 2, 1)));
        assertEquals(ErrorType.RECORD_NOT_FOUND, e.getErrorType());
    }

    @Test
    void snapshotFailureLeavesRecordUntouched() {
        when(snapshotter.computeSnapshot()).thenThrow(new PoliteiaException(ErrorType.CHAIN_TOO_YOUNG, "height 3"));
        assertThrows(PoliteiaException.class, () -> manager.startVote(startVotePayload(TOKEN, 3, 2, 1)));
        assertTrue(recordStore.getVettedMetadata(TOKEN).isEmpty());
    }
}
