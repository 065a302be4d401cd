package com.shading.sng.model;

public enum SocketDirection {
    INPUT,
    OUTPUT;

    public SocketDirection opposite() {
        return this == INPUT ? OUTPUT : INPUT;
    }
}
