package com.cloudant.handoff;

/**
 * Kind of mutation carried by a {@link ChangeChannel} event.
 */
public enum ChangeType {

    ADD,

    REMOVE;

}
