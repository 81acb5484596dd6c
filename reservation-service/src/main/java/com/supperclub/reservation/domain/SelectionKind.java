package com.supperclub.reservation.domain;

public enum SelectionKind {
    SALAD, ENTREE, DESSERT, WINE
}
