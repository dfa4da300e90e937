package com.codeasg.engine.cfg;

public record CfgEdge(int from, int to, FlowLabel label) {}
