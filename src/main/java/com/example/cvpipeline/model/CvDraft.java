package com.example.cvpipeline.model;

/**
 * A complete rendered draft: the stitched body, its header and the plain text they render to.
 */
public record CvDraft(StitchedDocument document, HeaderSection header, String text, int wordCount) {
}
