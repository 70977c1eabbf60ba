package com.sandkev.drainer.web;

import com.sandkev.drainer.checkpoint.CheckPoint;
import com.sandkev.drainer.checkpoint.CheckpointSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of the in-memory checkpoint; never hits the backend. */
@RestController
@RequiredArgsConstructor
public class CheckpointController {

    private final CheckPoint checkPoint;

    @GetMapping("/checkpoint")
    public CheckpointSnapshot current() {
        return checkPoint.pos();
    }
}
