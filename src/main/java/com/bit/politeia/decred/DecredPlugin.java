package com.bit.politeia.decred;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.dcrdata.DcrdataClient;
import com.bit.politeia.plugin.Plugin;
import com.bit.politeia.plugin.PluginCommand;
import com.bit.politeia.plugin.PluginSetting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Decred 投票插件：startvote / castvotes / bestblock
 */
@Slf4j
@Component
public class DecredPlugin implements Plugin {

    public static final String ID = "decred";
    public static final String VERSION = "1";

    public static final String CMD_STARTVOTE = "startvote";
    public static final String CMD_CASTVOTES = "castvotes";
    public static final String CMD_BESTBLOCK = "bestblock";

    // 元数据流编号
    public static final int MD_STREAM_VOTE_BITS = 14;
    public static final int MD_STREAM_VOTE_SNAPSHOT = 15;

    public static final String SETTING_DCRDATA_URL = "dcrdata";
    public static final String SETTING_NETWORK = "network";

    private final VoteSessionManager sessionManager;
    private final CastVoteProcessor castVoteProcessor;
    private final DcrdataClient dcrdataClient;
    private final PoliteiaProperties properties;

    @Autowired
    public DecredPlugin(VoteSessionManager sessionManager, CastVoteProcessor castVoteProcessor,
                        DcrdataClient dcrdataClient, PoliteiaProperties properties) {
        this.sessionManager = sessionManager;
        this.castVoteProcessor = castVoteProcessor;
        this.dcrdataClient = dcrdataClient;
        this.properties = properties;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }

    @Override
    public List<PluginSetting> getSettings() {
        return List.of(
                new PluginSetting(SETTING_DCRDATA_URL, properties.resolveDcrdataUrl()),
                new PluginSetting(SETTING_NETWORK, properties.getNetwork().name().toLowerCase()));
    }

    @Override
    public List<PluginCommand> getCommands() {
        return List.of(
                command(CMD_STARTVOTE, sessionManager::startVote),
                command(CMD_CASTVOTES, castVoteProcessor::castVotes),
                command(CMD_BESTBLOCK, payload -> bestBlock()));
    }

    /**
     * 当前最高区块高度，十进制字符串
     */
    public String bestBlock() {
        long height = dcrdataClient.bestBlock().getHeight();
        log.debug("bestblock: {}", height);
        return Long.toString(height);
    }

    private static PluginCommand command(String name, Function<String, String> handler) {
        return new PluginCommand() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public String execute(String payload) {
                return handler.apply(payload);
            }
        };
    }
}
