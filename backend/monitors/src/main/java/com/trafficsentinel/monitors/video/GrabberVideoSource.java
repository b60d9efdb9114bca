package com.trafficsentinel.monitors.video;

import com.trafficsentinel.monitors.api.VideoSource;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class GrabberVideoSource implements VideoSource<Frame> {
    private static final Logger LOGGER = Logger.getLogger(GrabberVideoSource.class.getName());

    private final int imageWidth;
    private final int imageHeight;
    private FFmpegFrameGrabber grabber;
    private String location;

    public GrabberVideoSource() {
        this(640, 360);
    }

    public GrabberVideoSource(int imageWidth, int imageHeight) {
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
    }

    @Override
    public void open(String location) {
        if (grabber != null) {
            throw new IllegalStateException("Video source already open: " + this.location);
        }
        FFmpegFrameGrabber candidate = new FFmpegFrameGrabber(location);
        if (imageWidth > 0 && imageHeight > 0) {
            candidate.setImageWidth(imageWidth);
            candidate.setImageHeight(imageHeight);
        }
        try {
            candidate.start();
        } catch (FrameGrabber.Exception e) {
            release(candidate, location);
            throw new IllegalStateException("Failed opening video source " + location, e);
        }
        this.grabber = candidate;
        this.location = location;
    }

    @Override
    public Optional<Frame> nextFrame() {
        FFmpegFrameGrabber current = requireOpen();
        try {
            Frame frame = current.grabImage();
            // the grabber reuses its buffers between calls
            return frame == null ? Optional.empty() : Optional.of(frame.clone());
        } catch (FrameGrabber.Exception e) {
            throw new IllegalStateException("Failed reading frame from " + location, e);
        }
    }

    @Override
    public void rewind() {
        FFmpegFrameGrabber current = requireOpen();
        try {
            current.setFrameNumber(0);
        } catch (FrameGrabber.Exception e) {
            throw new IllegalStateException("Failed rewinding " + location, e);
        }
    }

    @Override
    public void close() {
        if (grabber != null) {
            release(grabber, location);
            grabber = null;
        }
    }

    private FFmpegFrameGrabber requireOpen() {
        if (grabber == null) {
            throw new IllegalStateException("Video source is not open");
        }
        return grabber;
    }

    private static void release(FFmpegFrameGrabber grabber, String location) {
        try {
            grabber.close();
        } catch (FrameGrabber.Exception e) {
            LOGGER.log(Level.WARNING, "Failed releasing video source " + location, e);
        }
    }
}
