package com.shareplan.domain.model;

public enum ReferencePointType {
    PURCHASE,
    AS_OF_DATE
}
