package com.mirrorwatch.common.model;

/**
 * Version as advertised on an instance's about page.
 *
 * @param versionName link text, e.g. {@code 2023.07.22-72d8f35}
 * @param url         link target, e.g. {@code https://github.com/zedeus/nitter/commit/72d8f35}
 */
public record AboutVersion(String versionName, String url) {}
