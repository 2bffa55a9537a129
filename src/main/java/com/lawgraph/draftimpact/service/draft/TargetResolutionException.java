package com.lawgraph.draftimpact.service.draft;

/**
 * An amendment's target could not be mapped to a provision in the library.
 */
class TargetResolutionException extends Exception {

    TargetResolutionException(String message) {
        super(message);
    }
}
