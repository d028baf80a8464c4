package com.airroutes.backend.domain;

/**
 * Lifecycle of a scheduled flight. Only {@link #SCHEDULED} flights are
 * searchable; the transition to {@link #COMPLETED} happens outside this
 * service.
 */
public enum FlightStatus {
  SCHEDULED,
  COMPLETED,
  CANCELLED
}
