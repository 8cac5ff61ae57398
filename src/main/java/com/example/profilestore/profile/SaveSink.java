package com.example.profilestore.profile;

/**
 * Best-effort receiver of every successfully saved document.
 */
@FunctionalInterface
public interface SaveSink {

    SaveSink NONE = (ownerId, version, document) -> { };

    void forward(String ownerId, long version, String document);
}
