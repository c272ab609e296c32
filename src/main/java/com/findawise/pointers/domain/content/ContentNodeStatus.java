package com.findawise.pointers.domain.content;

/** Publication status of a content node. */
public enum ContentNodeStatus {
  ACTIVE,
  INACTIVE,
  BROKEN,
  PENDING,
  ARCHIVED
}
