package com.scholary.videoconcat.planning;

/** Why a record attempt was discarded. */
public enum AbandonReason {
  /** No video was eligible, even after relaxing the lower bound. */
  NO_CANDIDATES,

  /** Videos were eligible but none fit under the duration maximum. */
  NO_FITTING_CANDIDATE,

  /** The per-record selection budget ran out. */
  ATTEMPTS_EXHAUSTED,

  /** Assembly finished below the duration minimum. */
  BELOW_MINIMUM_DURATION,

  /** Assembly finished with fewer clips than the group-size minimum. */
  TOO_FEW_VIDEOS
}
