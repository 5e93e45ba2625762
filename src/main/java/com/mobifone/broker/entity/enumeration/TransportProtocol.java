package com.mobifone.broker.entity.enumeration;

public enum TransportProtocol {
    RDP,
    VNC,
    NX,
    SPICE
}
