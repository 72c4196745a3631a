package com.stylus.stream.broker.model;

public enum ChannelResponseStatus {
    GRANTED,
    QUEUED
}
