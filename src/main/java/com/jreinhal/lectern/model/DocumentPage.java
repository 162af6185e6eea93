package com.jreinhal.lectern.model;

public record DocumentPage(int pageNumber, String content) {
}
