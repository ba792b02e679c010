package com.aiadvent.ci.github;

import com.aiadvent.ci.shared.UpstreamServiceException;

class GitHubClientException extends UpstreamServiceException {

  GitHubClientException(String message) {
    super(message);
  }

  GitHubClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
