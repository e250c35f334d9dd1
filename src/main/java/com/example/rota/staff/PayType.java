package com.example.rota.staff;

public enum PayType {
    HOURLY,
    SALARIED
}
