package com.bit.bchpool.difficulty;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 矿池难度变更事件，由会话管理器转成 mining.set_difficulty 下发
 */
@Data
@AllArgsConstructor
public class DifficultyChangedEvent {
    private double previousDifficulty;
    private double newDifficulty;
}
