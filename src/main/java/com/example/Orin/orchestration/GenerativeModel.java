package com.example.Orin.orchestration;

/**
 * The generative model as seen by the orchestrator: given the conversation and the
 * tool catalog, it answers or asks for tools. It never executes tools itself.
 */
public interface GenerativeModel {

    /**
     * @throws com.example.Orin.exception.ModelUnavailableException when no model can be reached
     */
    ModelReply think(ModelRequest request);
}
