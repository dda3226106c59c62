package com.bit.bchpool.persistence;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlockRecord {
    private long height;
    private String hash;
    private String minerAddress;
    private long createdAt;
}
