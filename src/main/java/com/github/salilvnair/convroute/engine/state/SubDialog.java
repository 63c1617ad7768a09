package com.github.salilvnair.convroute.engine.state;

public enum SubDialog {
    NONE,
    AWAITING_CONTACT_INFO
}
