package com.williamcallahan.series_sync_engine.types;

public enum NotificationType {
    NEW_CHAPTER
}
