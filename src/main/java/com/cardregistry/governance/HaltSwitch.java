package com.cardregistry.governance;

/**
 * System-wide maintenance flag. While halted, ownership cannot change
 * (mint, burn and transfer are refused); use accounting keeps running.
 */
public interface HaltSwitch {

    boolean isHalted();
}
