package com.bit.bchpool.node;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MiningInfo {
    private long blocks;
    private double difficulty;
    private double networkHashps;
    private String chain;
}
