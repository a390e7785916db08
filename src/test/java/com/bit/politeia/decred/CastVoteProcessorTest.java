package com.bit.politeia.decred;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.crypto.CompactSigner;
import com.bit.politeia.crypto.DecredMessageVerifier;
import com.bit.politeia.crypto.DecredNet;
import com.bit.politeia.crypto.ServerIdentity;
import com.bit.politeia.dcrdata.CommitmentAddressResolver;
import com.bit.politeia.decred.model.CastVote;
import com.bit.politeia.decred.model.CastVoteReply;
import com.bit.politeia.decred.model.VoteStatus;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.OracleUnavailableException;
import com.bit.politeia.exception.PoliteiaException;
import com.bit.politeia.ledger.FileVoteLedger;
import com.bit.politeia.ledger.StorageLock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bitcoinj.core.ECKey;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class CastVoteProcessorTest {

    private static final String TOKEN = "abc123";
    private static final String TICKET_1 = "T1";
    private static final String TICKET_2 = "T2";
    private static final String TICKET_3 = "T3";

    @TempDir
    Path dataDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ECKey key1 = new ECKey();
    private final ECKey key2 = new ECKey();
    private final ECKey key3 = new ECKey();

    private PoliteiaProperties properties;
    private CommitmentAddressResolver resolver;
    private StorageLock lock;
    private FileVoteLedger ledger;
    private ServerIdentity identity;
    private CastVoteProcessor processor;

    @BeforeEach
    void setUp() throws Exception {
        properties = new PoliteiaProperties();
        properties.setDataDir(dataDir.toString());
        properties.setVerifyThreads(2);
        properties.setLockTimeout(Duration.ofSeconds(5));
        Files.createDirectories(properties.vettedDir().resolve(TOKEN));

        resolver = mock(CommitmentAddressResolver.class);
        when(resolver.largestCommitmentAddress(TICKET_1)).thenReturn(CompactSigner.address(key1, DecredNet.TESTNET3));
        when(resolver.largestCommitmentAddress(TICKET_2)).thenReturn(CompactSigner.address(key2, DecredNet.TESTNET3));
        when(resolver.largestCommitmentAddress(TICKET_3)).thenReturn(CompactSigner.address(key3, DecredNet.TESTNET3));

        lock = new StorageLock();
        ledger = new FileVoteLedger(properties, mapper, lock);
        identity = new ServerIdentity(properties, mapper);
        identity.init();
        processor = new CastVoteProcessor(new DecredPluginCodec(mapper), resolver, new DecredMessageVerifier(),
                ledger, lock, identity, properties);
        processor.init();
    }

    @AfterEach
    void tearDown() {
        processor.shutdown();
    }

    private static CastVote vote(ECKey key, String token, String ticket, String voteBit) {
        return new CastVote(token, ticket, voteBit, CompactSigner.signHex(key, token + ticket + voteBit));
    }

    private List<String> ledgerLines(String token) throws Exception {
        Path file = ledger.ledgerFile(token);
        return Files.exists(file) ? Files.readAllLines(file) : new ArrayList<>();
    }

    private void assertAccepted(CastVoteReply reply, CastVote vote) {
        assertNull(reply.getError(), reply.getError());
        assertNull(reply.getErrorStatus());
        assertEquals(vote.getSignature(), reply.getClientSignature());
        assertTrue(ServerIdentity.verify(identity.getPublicKey(),
                vote.getSignature().getBytes(StandardCharsets.UTF_8), Hex.decode(reply.getSignature())));
    }

    private static void assertRejected(CastVoteReply reply, VoteStatus status) {
        assertEquals(status, reply.getErrorStatus());
        assertNull(reply.getSignature());
        assertTrue(reply.getError() != null && !reply.getError().isEmpty());
    }

    @Test
    void acceptsValidRejectsDuplicateAndTampered() throws Exception {
        CastVote v1 = vote(key1, TOKEN, TICKET_1, "1");
        CastVote dup = vote(key1, TOKEN, TICKET_1, "2");
        CastVote tampered = vote(key2, TOKEN, TICKET_2, "1");
        tampered.setVoteBit("2");

        List<CastVoteReply> replies = processor.castVotes(Arrays.asList(v1, dup, tampered));
        assertEquals(3, replies.size());
        assertAccepted(replies.get(0), v1);
        assertRejected(replies.get(1), VoteStatus.DUPLICATE_IN_BATCH);
        assertRejected(replies.get(2), VoteStatus.INVALID_SIGNATURE);

        List<String> lines = ledgerLines(TOKEN);
        assertEquals(1, lines.size());
        assertEquals(v1, mapper.readValue(lines.get(0), CastVote.class));
    }

    @Test
    void resubmissionIsAlreadyVotedAndLedgerUnchanged() throws Exception {
        CastVote v1 = vote(key1, TOKEN, TICKET_1, "1");
        assertAccepted(processor.castVotes(List.of(v1)).get(0), v1);
        long size = Files.size(ledger.ledgerFile(TOKEN));

        assertRejected(processor.castVotes(List.of(v1)).get(0), VoteStatus.ALREADY_VOTED);
        // 改变投票位同样被拒绝，首票有效
        assertRejected(processor.castVotes(List.of(vote(key1, TOKEN, TICKET_1, "2"))).get(0), VoteStatus.ALREADY_VOTED);
        assertEquals(size, Files.size(ledger.ledgerFile(TOKEN)));
    }

    @Test
    void oracleFailureRejectsOnlyThatVote() throws Exception {
        String unknownTicket = "T4";
        when(resolver.largestCommitmentAddress(unknownTicket)).thenThrow(new OracleUnavailableException("timeout"));
        CastVote good = vote(key1, TOKEN, TICKET_1, "1");
        CastVote unknown = vote(key1, TOKEN, unknownTicket, "1");

        List<CastVoteReply> replies = processor.castVotes(List.of(unknown, good));
        assertRejected(replies.get(0), VoteStatus.ORACLE_ERROR);
        assertAccepted(replies.get(1), good);
        assertEquals(1, ledgerLines(TOKEN).size());
    }

    @Test
    void malformedVotes() throws Exception {
        CastVote badToken = vote(key1, "../ab", TICKET_1, "1");
        CastVote badBit = vote(key1, TOKEN, TICKET_1, "xyz");
        CastVote badSigEncoding = new CastVote(TOKEN, TICKET_2, "1", "zz-not-hex");
        CastVote badTicket = vote(key3, TOKEN, "../api", "1");

        List<CastVoteReply> replies = processor.castVotes(Arrays.asList(badToken, badBit, badSigEncoding, null, badTicket));
        assertRejected(replies.get(0), VoteStatus.MALFORMED_VOTE);
        assertRejected(replies.get(1), VoteStatus.MALFORMED_VOTE);
        assertRejected(replies.get(2), VoteStatus.INVALID_SIGNATURE);
        assertRejected(replies.get(3), VoteStatus.MALFORMED_VOTE);
        assertRejected(replies.get(4), VoteStatus.MALFORMED_VOTE);
        assertTrue(ledgerLines(TOKEN).isEmpty());
    }

    @Test
    void tokenFailureIsolatedFromOtherTokens() throws Exception {
        String missing = "dead01";
        String corrupt = "beef02";
        Files.createDirectories(properties.vettedDir().resolve(corrupt));
        Files.write(ledger.ledgerFile(corrupt), "{garbage\n".getBytes(StandardCharsets.UTF_8));

        CastVote toMissing = vote(key1, missing, TICKET_1, "1");
        CastVote toCorrupt = vote(key2, corrupt, TICKET_2, "1");
        CastVote good = vote(key3, TOKEN, TICKET_3, "1");

        List<CastVoteReply> replies = processor.castVotes(List.of(toMissing, toCorrupt, good));
        assertRejected(replies.get(0), VoteStatus.TOKEN_FAILED);
        assertRejected(replies.get(1), VoteStatus.TOKEN_FAILED);
        assertAccepted(replies.get(2), good);
        assertEquals(1, ledgerLines(corrupt).size());
    }

    @Test
    void payloadRoundTrip() {
        CastVote v1 = vote(key1, TOKEN, TICKET_1, "1");
        String payload = new DecredPluginCodec(mapper).encode(List.of(v1));
        List<CastVoteReply> replies = new DecredPluginCodec(mapper).decodeCastVoteReplies(processor.castVotes(payload));
        assertAccepted(replies.get(0), v1);

        assertEquals(ErrorType.MALFORMED_REQUEST,
                assertThrows(PoliteiaException.class, () -> processor.castVotes("{\"not\":\"a list\"}")).getErrorType());
    }

    @Test
    void concurrentSubmissionsOfSameVoteAcceptOnce() throws Exception {
        CastVote v1 = vote(key1, TOKEN, TICKET_1, "1");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CastVoteReply>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return processor.castVotes(List.of(v1)).get(0);
            }));
        }
        start.countDown();
        int accepted = 0;
        for (Future<CastVoteReply> future : futures) {
            CastVoteReply reply = future.get(30, TimeUnit.SECONDS);
            if (reply.getError() == null) {
                accepted++;
            } else {
                assertEquals(VoteStatus.ALREADY_VOTED, reply.getErrorStatus());
            }
        }
        pool.shutdown();
        assertEquals(1, accepted);
        assertEquals(1, ledgerLines(TOKEN).size());
    }

    @Test
    void concurrentSubmissionsOnDifferentTokensAllAccepted() throws Exception {
        String[] tokens = {"a1", "b2", "c3", "d4"};
        for (String token : tokens) {
            Files.createDirectories(properties.vettedDir().resolve(token));
        }
        ExecutorService pool = Executors.newFixedThreadPool(tokens.length);
        List<Future<List<CastVoteReply>>> futures = new ArrayList<>();
        for (String token : tokens) {
            futures.add(pool.submit(() -> processor.castVotes(List.of(
                    vote(key1, token, TICKET_1, "1"), vote(key2, token, TICKET_2, "2")))));
        }
        for (Future<List<CastVoteReply>> future : futures) {
            for (CastVoteReply reply : future.get(30, TimeUnit.SECONDS)) {
                assertNull(reply.getError(), reply.getError());
            }
        }
        pool.shutdown();
        for (String token : tokens) {
            assertEquals(2, ledgerLines(token).size());
        }
    }

    @Test
    void busyLockFailsWholeCallButRejectedBatchNeedsNoLock() throws Exception {
        properties.setLockTimeout(Duration.ofMillis(100));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try (StorageLock.Handle ignored = lock.acquire(Duration.ofSeconds(1))) {
                held.countDown();
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        holder.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));
        try {
            PoliteiaException e = assertThrows(PoliteiaException.class,
                    () -> processor.castVotes(List.of(vote(key1, TOKEN, TICKET_1, "1"))));
            assertEquals(ErrorType.BACKEND_BUSY, e.getErrorType());

            CastVote tampered = vote(key2, TOKEN, TICKET_2, "1");
            tampered.setVoteBit("2");
            assertRejected(processor.castVotes(List.of(tampered)).get(0), VoteStatus.INVALID_SIGNATURE);
        } finally {
            release.countDown();
            holder.join(5000);
        }
        assertTrue(ledgerLines(TOKEN).isEmpty());
    }

    @Test
    void backendShutdownFailsWholeCallWithoutTouchingLedger() throws Exception {
        CastVote v1 = vote(key1, TOKEN, TICKET_1, "1");
        assertAccepted(processor.castVotes(List.of(v1)).get(0), v1);
        byte[] before = Files.readAllBytes(ledger.ledgerFile(TOKEN));

        lock.shutdown();
        PoliteiaException e = assertThrows(PoliteiaException.class,
                () -> processor.castVotes(List.of(vote(key2, TOKEN, TICKET_2, "1"))));
        assertEquals(ErrorType.SHUTDOWN_IN_PROGRESS, e.getErrorType());
        assertTrue(Arrays.equals(before, Files.readAllBytes(ledger.ledgerFile(TOKEN))));
    }

    @Test
    void closedVerifyPoolFailsFastInsteadOfBlocking() throws Exception {
        processor.shutdown();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<List<CastVoteReply>> future = pool.submit(
                    () -> processor.castVotes(List.of(vote(key1, TOKEN, TICKET_1, "1"))));
            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            PoliteiaException cause = assertInstanceOf(PoliteiaException.class, e.getCause());
            assertEquals(ErrorType.SHUTDOWN_IN_PROGRESS, cause.getErrorType());
        } finally {
            pool.shutdownNow();
        }
        assertTrue(ledgerLines(TOKEN).isEmpty());
    }

    @Test
    void interruptedAppendTailDoesNotBlockToken() throws Exception {
        Files.write(ledger.ledgerFile(TOKEN),
                "{\"token\":\"abc123\",\"ticket\":\"T9\",\"vo".getBytes(StandardCharsets.UTF_8));

        CastVote v1 = vote(key1, TOKEN, TICKET_1, "1");
        assertAccepted(processor.castVotes(List.of(v1)).get(0), v1);
        assertRejected(processor.castVotes(List.of(v1)).get(0), VoteStatus.ALREADY_VOTED);

        List<String> lines = ledgerLines(TOKEN);
        assertEquals(1, lines.size());
        assertEquals(v1, mapper.readValue(lines.get(0), CastVote.class));
    }
}
