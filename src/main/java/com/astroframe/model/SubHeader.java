package com.astroframe.model;

public class SubHeader {

    public final String name;     // component name (I1) or raw file name
    public final HeaderSet header;

    public SubHeader(String name, HeaderSet header) {
        this.name = name;
        this.header = header;
    }

    @Override
    public String toString() {
        return name + " (" + header.size() + " cards)";
    }
}
