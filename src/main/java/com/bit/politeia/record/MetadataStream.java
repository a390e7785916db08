package com.bit.politeia.record;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 附加在提案记录上的元数据流，负载对存储不透明
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetadataStream {
    private int id;
    private String payload;
}
