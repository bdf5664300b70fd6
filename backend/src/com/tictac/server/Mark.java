package com.tictac.server;

public enum Mark {
    X,
    O
}
