package com.topolens.core.model;

public record Listen(String ip, String port, boolean proxied) {}
