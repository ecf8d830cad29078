package com.retail.herd.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ShardWorkerTest {

    @Test
    void firstBucket_setsWatermarkOutright() {
        ShardWorker shard = new ShardWorker(0, 16);

        assertThat(shard.advanceWatermark(1_000, 1)).isTrue();
        assertThat(shard.getWatermarkIndex()).isEqualTo(1_000);
    }

    @Test
    void laterBucket_movesWatermarkByAtMostTheStep() {
        ShardWorker shard = new ShardWorker(0, 16);
        shard.advanceWatermark(100, 1);

        assertThat(shard.advanceWatermark(8_640, 1)).isTrue();
        assertThat(shard.getWatermarkIndex()).isEqualTo(101);

        assertThat(shard.advanceWatermark(8_640, 3)).isTrue();
        assertThat(shard.getWatermarkIndex()).isEqualTo(104);

        assertThat(shard.advanceWatermark(105, 10)).isTrue();
        assertThat(shard.getWatermarkIndex()).isEqualTo(105);
    }

    @Test
    void olderOrSameBucket_leavesWatermarkAlone() {
        ShardWorker shard = new ShardWorker(0, 16);
        shard.advanceWatermark(100, 1);

        assertThat(shard.advanceWatermark(100, 1)).isFalse();
        assertThat(shard.advanceWatermark(42, 1)).isFalse();
        assertThat(shard.getWatermarkIndex()).isEqualTo(100);
    }
}
