package com.incidentdesk.incident.client;

import java.util.Optional;

/** 現在の当番担当者を返す。リマインダー本文の宛先決定にのみ使う。 */
public interface DutyRosterClient {

  Optional<String> currentResponsible();
}
