package com.bit.politeia.decred;

import com.bit.politeia.decred.model.CastVote;
import com.bit.politeia.decred.model.CastVoteReply;
import com.bit.politeia.decred.model.StartVoteReply;
import com.bit.politeia.decred.model.Vote;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * decred 插件命令负载的 JSON 编解码，解码失败整体报 MALFORMED_REQUEST
 */
@Component
public class DecredPluginCodec {

    private static final TypeReference<List<CastVote>> CAST_VOTES_TYPE = new TypeReference<List<CastVote>>() {
    };
    private static final TypeReference<List<CastVoteReply>> CAST_VOTE_REPLIES_TYPE = new TypeReference<List<CastVoteReply>>() {
    };

    private final ObjectMapper objectMapper;

    @Autowired
    public DecredPluginCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Vote decodeVote(String payload) {
        return decode(payload, Vote.class, "Vote");
    }

    public StartVoteReply decodeStartVoteReply(String payload) {
        return decode(payload, StartVoteReply.class, "StartVoteReply");
    }

    public List<CastVote> decodeCastVotes(String payload) {
        if (payload == null) {
            throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, "CastVotes 负载为空");
        }
        try {
            List<CastVote> votes = objectMapper.readValue(payload, CAST_VOTES_TYPE);
            if (votes == null) {
                throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, "CastVotes 负载为空");
            }
            return votes;
        } catch (JsonProcessingException e) {
            throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, "CastVotes 解码失败: " + e.getOriginalMessage(), e);
        }
    }

    public List<CastVoteReply> decodeCastVoteReplies(String payload) {
        try {
            return objectMapper.readValue(payload, CAST_VOTE_REPLIES_TYPE);
        } catch (JsonProcessingException e) {
            throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, "CastVoteReply 解码失败: " + e.getOriginalMessage(), e);
        }
    }

    public String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 编码失败: " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T decode(String payload, Class<T> type, String name) {
        if (payload == null) {
            throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, name + " 负载为空");
        }
        try {
            T value = objectMapper.readValue(payload, type);
            if (value == null) {
                throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, name + " 负载为空");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, name + " 解码失败: " + e.getOriginalMessage(), e);
        }
    }
}
