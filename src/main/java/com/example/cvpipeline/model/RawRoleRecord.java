package com.example.cvpipeline.model;

/**
 * Unparsed role text as stored in the corpus.
 *
 * @param sourceName  file name or document id, used for the role id and in error messages
 * @param recencyRank 1 = most recent
 * @param content     raw text
 */
public record RawRoleRecord(String sourceName, int recencyRank, String content) {
}
