package com.tony.gridironSim.exception;

import java.time.LocalDateTime;

/**
 * Une donnée de backtest est horodatée après la limite de décision (coup d'envoi).
 */
public class LookAheadViolationException extends RuntimeException {

    public LookAheadViolationException(String what, LocalDateTime availableAt, LocalDateTime cutoff) {
        super(String.format("Fuite de données : %s disponible le %s, après la limite %s", what, availableAt, cutoff));
    }
}
