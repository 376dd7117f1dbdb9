package com.platform.hacontroller.api;

import com.platform.hacontroller.autoscale.AutoscaleController;
import com.platform.hacontroller.autoscale.AutoscaleStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scaling")
@RequiredArgsConstructor
public class ScalingController {

    private final AutoscaleController autoscaleController;

    @GetMapping
    public AutoscaleStatus getStatus() {
        return autoscaleController.status();
    }
}
