package com.mirrorwatch.common.model;

/** Health relevant part of a rendered profile page. */
public record ProfileContent(String name, int postCount) {}
