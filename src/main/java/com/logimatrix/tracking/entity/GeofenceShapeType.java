package com.logimatrix.tracking.entity;

public enum GeofenceShapeType {
    CIRCLE,
    POLYGON
}
