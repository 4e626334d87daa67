package com.lightwatch.service;

public record ScanReport(int candidates, int transitioned, int failed) {
}
