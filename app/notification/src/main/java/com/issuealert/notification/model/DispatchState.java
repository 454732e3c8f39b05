package com.issuealert.notification.model;

/** アラート 1 件分の配信状態。RECEIVED -> {DIGESTING, IMMEDIATE} -> DELIVERED。 */
public enum DispatchState {
  RECEIVED,
  SKIPPED,
  DIGESTING,
  IMMEDIATE,
  DELIVERED
}
