package com.deepansh.research.provider;

public record NewsArticle(String title, String url, String description, String age) {
}
