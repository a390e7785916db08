package com.bit.politeia.dcrdata;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.exception.OracleUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;

/**
 * 基于 RestTemplate 的 dcrdata 客户端，纯查询，无本地状态
 */
@Slf4j
@Component
public class HttpDcrdataClient implements DcrdataClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    @Autowired
    public HttpDcrdataClient(RestTemplateBuilder builder, PoliteiaProperties properties) {
        this.restTemplate = builder
                .setConnectTimeout(properties.getHttpTimeout())
                .setReadTimeout(properties.getHttpTimeout())
                .build();
        this.baseUrl = properties.resolveDcrdataUrl();
        log.info("dcrdata 地址: {}", baseUrl);
    }

    public RestTemplate getRestTemplate() {
        return restTemplate;
    }

    @Override
    public BlockDataBasic bestBlock() {
        return get("api/block/best", BlockDataBasic.class);
    }

    @Override
    public BlockDataBasic block(long height) {
        return get("api/block/" + height, BlockDataBasic.class);
    }

    @Override
    public List<String> ticketPool(String blockHash) {
        String[] tickets = get("api/stake/pool/b/" + blockHash + "/full?sort=true", String[].class);
        return Arrays.asList(tickets);
    }

    @Override
    public TrimmedTx transaction(String txHash) {
        return get("api/tx/" + txHash, TrimmedTx.class);
    }

    private <T> T get(String path, Class<T> type) {
        String url = baseUrl + path;
        log.debug("connecting to {}", url);
        ResponseEntity<T> response;
        try {
            response = restTemplate.getForEntity(url, type);
        } catch (RestClientException e) {
            throw new OracleUnavailableException("请求失败 " + url + ": " + e.getMessage(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new OracleUnavailableException("非预期状态码 " + response.getStatusCode().value() + ": " + url);
        }
        T body = response.getBody();
        if (body == null) {
            throw new OracleUnavailableException("响应为空: " + url);
        }
        return body;
    }
}
