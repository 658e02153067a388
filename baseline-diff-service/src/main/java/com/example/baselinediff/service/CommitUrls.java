package com.example.baselinediff.service;

/**
 * Read-time derivation of a commit's browse URL.
 */
public final class CommitUrls {

    private CommitUrls() {
    }

    /**
     * The review URL when the commit has one, else {@code {remoteUrl}/{project}/commit/{hash}}
     * when the project has a remote, else null.
     */
    public static String derive(String reviewUrl, String remoteUrl, String project, String contentHash) {
        if (reviewUrl != null && !reviewUrl.isBlank()) {
            return reviewUrl;
        }
        if (remoteUrl == null || remoteUrl.isBlank()) {
            return null;
        }
        return remoteUrl + "/" + project + "/commit/" + contentHash;
    }
}
