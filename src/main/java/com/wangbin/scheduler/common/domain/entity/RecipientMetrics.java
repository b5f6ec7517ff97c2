package com.wangbin.scheduler.common.domain.entity;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 接收人在回看窗口内的活动指标快照。
 */
@Value
@Builder
public class RecipientMetrics {

    int totalReviews;
    int totalNewProjects;

    /** 平均分，没有评审时为null */
    Double averageScore;

    /** 最高分曲目，没有评审时为null */
    TopTrack topTrack;

    /** 连续创作数据，不可用时为null */
    Streak streak;

    @Builder.Default
    List<SkillGain> skillGains = Collections.emptyList();

    String archetype;

    public static RecipientMetrics empty() {
        return RecipientMetrics.builder().build();
    }

    public int currentStreak() {
        return streak == null ? 0 : streak.current();
    }

    /**
     * 有评审、新项目或连续创作记录之一即视为活跃。
     */
    public boolean hasActivity() {
        return totalReviews > 0 || totalNewProjects > 0 || currentStreak() > 0;
    }

    public record TopTrack(String track, double score) {
    }

    public record Streak(int current, int longest, int totalUploads, int totalReviews) {
    }

    public record SkillGain(String dimension, double latestScore, double delta) {
    }
}
