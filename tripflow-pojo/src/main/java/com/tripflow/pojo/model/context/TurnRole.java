package com.tripflow.pojo.model.context;

public enum TurnRole {
    USER,
    ASSISTANT
}
