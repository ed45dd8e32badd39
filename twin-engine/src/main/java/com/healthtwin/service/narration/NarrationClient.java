package com.healthtwin.service.narration;

/**
 * Language-model collaborator that turns a prompt into narrative text.
 * Implementations are supplied by the host application.
 */
public interface NarrationClient {

    String narrate(String prompt) throws Exception;
}
