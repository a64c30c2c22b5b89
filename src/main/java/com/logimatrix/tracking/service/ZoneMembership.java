package com.logimatrix.tracking.service;

/**
 * Last observed classification of a vehicle against one geofence.
 * An absent entry means unknown.
 */
public enum ZoneMembership {
    INSIDE,
    OUTSIDE
}
