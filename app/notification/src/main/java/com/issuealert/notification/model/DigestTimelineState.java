package com.issuealert.notification.model;

/** READY は flush 待ち、WAITING は次の deadline まで蓄積中。 */
public enum DigestTimelineState {
  READY,
  WAITING
}
