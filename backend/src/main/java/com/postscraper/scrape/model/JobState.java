package com.postscraper.scrape.model;

public enum JobState {
    PENDING,
    INVOKING,
    CLASSIFYING,
    RETRYING,
    REFRESHING,
    SUCCEEDED,
    FAILED
}
