package me.golemcore.coder.domain.model;

public enum FileChangeOperation {
    CREATE, MODIFY, DELETE
}
