package com.example.rota.location;

import com.example.rota.breaks.BreakTier;

import java.util.List;

public record LocationRequest(String name,
                              Double latitude,
                              Double longitude,
                              Integer clockInRadiusMetres,
                              List<BreakTier> breakTiers,
                              Boolean active) {
}
