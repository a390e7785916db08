package com.bit.politeia.api;

import com.bit.politeia.crypto.ServerIdentity;
import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import com.bit.politeia.plugin.PluginInfo;
import com.bit.politeia.plugin.PluginRegistry;
import com.bit.politeia.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/v1")
public class PluginApi {

    @Autowired
    private PluginRegistry pluginRegistry;

    @Autowired
    private ServerIdentity serverIdentity;

    // 执行插件命令，失败由 ApiExceptionHandler 统一转换
    @PostMapping("/plugin")
    public Result<PluginCommandReply> pluginCommand(@RequestBody PluginCommandRequest request) {
        if (request.getId() == null || request.getCommand() == null) {
            throw new PoliteiaException(ErrorType.MALFORMED_REQUEST, "缺少插件ID或命令");
        }
        log.debug("插件命令 id={} command={} commandid={}", request.getId(), request.getCommand(), request.getCommandId());
        String reply = pluginRegistry.execute(request.getId(), request.getCommand(), request.getPayload());
        return Result.ok(new PluginCommandReply(request.getId(), request.getCommand(), request.getCommandId(), reply));
    }

    // 插件清单
    @GetMapping("/plugin")
    public Result<List<PluginInfo>> inventory() {
        return Result.ok(pluginRegistry.inventory());
    }

    // 服务公钥，用于验证反签
    @GetMapping("/identity")
    public Result<IdentityReply> identity() {
        return Result.ok(new IdentityReply(serverIdentity.getPublicKeyHex()));
    }
}
