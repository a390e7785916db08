package com.bit.politeia.ledger;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.decred.model.CastVote;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.LedgerCorruptException;
import com.bit.politeia.exception.PoliteiaException;
import com.bit.politeia.util.TokenUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.ByteStreams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 文件账本：每个提案一个文件 vetted/{token}/votes，每行一条 JSON 投票记录，只追加
 */
@Slf4j
@Component
public class FileVoteLedger implements VoteLedger {

    public static final String VOTES_FILE = "votes";

    private final Path vettedDir;
    private final ObjectMapper objectMapper;
    private final StorageLock storageLock;

    @Autowired
    public FileVoteLedger(PoliteiaProperties properties, ObjectMapper objectMapper, StorageLock storageLock) {
        this(properties.vettedDir(), objectMapper, storageLock);
    }

    public FileVoteLedger(Path vettedDir, ObjectMapper objectMapper, StorageLock storageLock) {
        this.vettedDir = vettedDir;
        this.objectMapper = objectMapper;
        this.storageLock = storageLock;
    }

    public Path ledgerFile(String token) {
        return vettedDir.resolve(token).resolve(VOTES_FILE);
    }

    @Override
    public LedgerHandle open(String token) {
        if (!TokenUtils.isHexKey(token)) {
            throw new PoliteiaException(ErrorType.MALFORMED_TOKEN, "令牌不能作为账本键: " + token);
        }
        Path recordDir = vettedDir.resolve(token);
        if (!Files.isDirectory(recordDir)) {
            throw new PoliteiaException(ErrorType.RECORD_NOT_FOUND, "提案记录不存在: " + token);
        }
        Path file = recordDir.resolve(VOTES_FILE);
        try {
            FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
            return new FileLedgerHandle(token, file, channel);
        } catch (IOException e) {
            throw new PoliteiaException(ErrorType.LEDGER_IO, "打开账本失败: " + file, e);
        }
    }

    private class FileLedgerHandle implements LedgerHandle {
        private final String token;
        private final Path file;
        private final FileChannel channel;
        // 已确认完整的记录末尾，-1 表示尚未重放
        private long validEnd = -1;

        FileLedgerHandle(String token, Path file, FileChannel channel) {
            this.token = token;
            this.file = file;
            this.channel = channel;
        }

        @Override
        public String getToken() {
            return token;
        }

        @Override
        public DedupIndex replay() {
            DedupIndex index = new DedupIndex();
            long lineNo = 0;
            try {
                long end = completeEnd();
                channel.position(0);
                // 不关闭 reader，避免连带关闭底层 channel
                BufferedReader reader = new BufferedReader(new InputStreamReader(
                        ByteStreams.limit(Channels.newInputStream(channel), end),
                        StandardCharsets.UTF_8.newDecoder()), 8192);
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNo++;
                    if (line.isBlank()) {
                        continue;
                    }
                    CastVote vote;
                    try {
                        vote = objectMapper.readValue(line, CastVote.class);
                    } catch (JsonProcessingException e) {
                        throw new LedgerCorruptException(token, lineNo, "记录无法解码", e);
                    }
                    if (vote == null || !token.equals(vote.getToken()) || vote.getTicket() == null) {
                        throw new LedgerCorruptException(token, lineNo, "记录令牌或票为空/不匹配", null);
                    }
                    if (!index.add(vote.getToken(), vote.getTicket())) {
                        throw new LedgerCorruptException(token, lineNo, "票重复出现: " + vote.getTicket(), null);
                    }
                }
                validEnd = end;
            } catch (CharacterCodingException e) {
                throw new LedgerCorruptException(token, lineNo + 1, "记录不是合法的UTF-8", e);
            } catch (IOException | UncheckedIOException e) {
                throw new PoliteiaException(ErrorType.LEDGER_IO, "读取账本失败: " + file, e);
            }
            log.debug("账本重放完成 token={} 记录数={}", token, index.size());
            return index;
        }

        /**
         * 计算完整记录的末尾偏移。
         * 末行没有换行且无法解码时视为追加中断留下的半条记录，不计入账本，下次追加前截掉
         */
        private long completeEnd() throws IOException {
            long size = channel.size();
            if (size == 0 || endsWithNewline(size)) {
                return size;
            }
            long tailStart = lastNewline(size) + 1;
            ByteBuffer tail = ByteBuffer.allocate((int) (size - tailStart));
            while (tail.hasRemaining()) {
                if (channel.read(tail, tailStart + tail.position()) < 0) {
                    break;
                }
            }
            try {
                objectMapper.readValue(tail.array(), 0, tail.position(), CastVote.class);
                return size;
            } catch (IOException e) {
                log.warn("账本末尾存在未完成的记录，将被丢弃 token={} offset={} bytes={}",
                        token, tailStart, size - tailStart);
                return tailStart;
            }
        }

        private long lastNewline(long size) throws IOException {
            ByteBuffer chunk = ByteBuffer.allocate(4096);
            long pos = size;
            while (pos > 0) {
                int len = (int) Math.min(chunk.capacity(), pos);
                pos -= len;
                chunk.clear();
                chunk.limit(len);
                while (chunk.hasRemaining()) {
                    if (channel.read(chunk, pos + chunk.position()) < 0) {
                        break;
                    }
                }
                for (int k = chunk.position() - 1; k >= 0; k--) {
                    if (chunk.get(k) == '\n') {
                        return pos + k;
                    }
                }
            }
            return -1;
        }

        @Override
        public void append(CastVote vote) {
            if (!storageLock.isHeldByCurrentThread()) {
                throw new IllegalStateException("追加账本前必须持有写锁");
            }
            byte[] record;
            try {
                record = (objectMapper.writeValueAsString(vote) + "\n").getBytes(StandardCharsets.UTF_8);
            } catch (JsonProcessingException e) {
                throw new PoliteiaException(ErrorType.LEDGER_IO, "投票记录无法编码: " + file, e);
            }
            long end = -1;
            try {
                end = channel.size();
                if (validEnd >= 0 && validEnd < end) {
                    // 截掉重放时识别出的半条记录
                    channel.truncate(validEnd);
                    end = validEnd;
                }
                ByteBuffer buffer;
                if (end > 0 && !endsWithNewline(end)) {
                    // 上一条记录缺少换行，补齐后再写，保证一行一条
                    buffer = ByteBuffer.allocate(record.length + 1);
                    buffer.put((byte) '\n');
                    buffer.put(record);
                    buffer.flip();
                } else {
                    buffer = ByteBuffer.wrap(record);
                }
                long position = end;
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(false);
                validEnd = position;
            } catch (IOException e) {
                rollback(end, e);
                throw new PoliteiaException(ErrorType.LEDGER_IO, "追加账本失败: " + file, e);
            }
        }

        // 写入失败时回退到追加前的长度，避免半条记录留在文件末尾
        private void rollback(long end, IOException cause) {
            if (end < 0) {
                return;
            }
            try {
                channel.truncate(end);
                channel.force(false);
                validEnd = end;
            } catch (IOException e) {
                cause.addSuppressed(e);
                log.error("追加失败后回退账本失败，下次重放将丢弃残留的半条记录: {} offset={}", file, end, e);
            }
        }

        private boolean endsWithNewline(long size) throws IOException {
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.read(last, size - 1);
            return last.get(0) == '\n';
        }

        @Override
        public void close() {
            try {
                channel.close();
            } catch (IOException e) {
                log.error("关闭账本失败: {}", file, e);
            }
        }
    }
}
