package com.tango.stream.raffle.service;

import com.tango.stream.raffle.model.DrawResult;

import javax.annotation.Nonnull;

public interface DrawNotifier {

    void onDraw(@Nonnull DrawResult result);
}
