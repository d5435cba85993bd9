package com.osservatorio.common.exception;

import com.osservatorio.common.model.Subsystem;
import lombok.Getter;

@Getter
public class PersistenceException extends OsservatorioException {

    private final Subsystem subsystem;

    public PersistenceException(Subsystem subsystem, String message) {
        super("[" + subsystem + "] " + message);
        this.subsystem = subsystem;
    }

    public PersistenceException(Subsystem subsystem, String message, Throwable cause) {
        super("[" + subsystem + "] " + message, cause);
        this.subsystem = subsystem;
    }
}
