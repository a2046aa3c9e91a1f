package com.statgrid.service.core.statistic;

public record KeyedStatistic(String naturalKeyHash, StatisticRow row) {}
