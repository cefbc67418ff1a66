package com.p14n.subsync.service;

public enum ServiceState {
    Created,
    Started,
    Stopped,
    Disposed
}
