package com.astroframe.model;

public enum CardType { STRING, FLOAT, INT, LOGICAL }
