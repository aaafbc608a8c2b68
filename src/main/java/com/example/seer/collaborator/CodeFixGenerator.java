package com.example.seer.collaborator;

/**
 * Produces a corrected version of a source file for a diagnosed problem.
 */
public interface CodeFixGenerator {

    CodeFixResult generate(CodeFixRequest request);
}
