package com.bmsedge.sellout.profile;

public enum NameCase {
    PRESERVE,
    UPPER
}
