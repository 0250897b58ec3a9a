package com.questrail.hostlink.registry;

import com.questrail.hostlink.api.SafetyTier;

import java.util.List;

/**
 * StandardCommands
 * -----------------------------------------------------------------------------
 * The stock host command catalog with its safety tiers. Every entry forwards
 * 1:1 to the session API.
 *
 * <p>Only idempotent value setters and fire-style triggers are lossy-eligible.
 * Note that {@code fire_clip} and {@code fire_scene} restart from the top on
 * every fire, so a duplicate or dropped fire is corrected by the next one.</p>
 */
public final class StandardCommands {

    public static final List<String> LOSSY_ELIGIBLE = List.of(
        "set_device_parameter",
        "set_track_volume",
        "set_track_pan",
        "set_track_mute",
        "set_track_solo",
        "set_track_arm",
        "set_send_amount",
        "set_master_volume",
        "set_clip_launch_mode",
        "fire_clip",
        "fire_scene"
    );

    public static final List<String> NEVER_LOSSY = List.of(
        // queries
        "get_session_info",
        "get_session_overview",
        "get_track_info",
        "get_all_tracks",
        "get_all_scenes",
        "get_all_clips_in_track",
        "get_master_track_info",
        "get_return_tracks",
        "get_device_parameters",
        "get_clip_notes",
        "get_clip_envelopes",
        "get_clip_follow_actions",
        "get_clip_warp_markers",
        "get_playhead_position",
        "get_browser_item",
        "get_browser_tree",
        "get_browser_categories",
        "get_browser_items",
        "get_browser_items_at_path",
        // tracks
        "create_midi_track",
        "create_audio_track",
        "delete_track",
        "delete_all_tracks",
        "duplicate_track",
        "set_track_name",
        "set_track_color",
        "set_track_fold",
        "set_track_monitoring_state",
        "group_tracks",
        "ungroup_tracks",
        // clips and notes
        "create_clip",
        "delete_clip",
        "duplicate_clip",
        "duplicate_clip_to",
        "move_clip",
        "crop_clip",
        "resize_clip",
        "stretch_clip",
        "mix_clip",
        "set_clip_name",
        "set_clip_loop",
        "set_clip_follow_action",
        "set_clip_warp_mode",
        "add_warp_marker",
        "delete_warp_marker",
        "quantize_clip",
        "transpose_clip",
        "stop_clip",
        "add_notes_to_clip",
        "delete_notes_from_clip",
        "set_note_velocity",
        "set_note_duration",
        "set_note_pitch",
        // scenes
        "create_scene",
        "delete_scene",
        "duplicate_scene",
        "set_scene_name",
        // devices and automation
        "load_browser_item",
        "load_instrument_or_effect",
        "load_instrument_preset",
        "duplicate_device",
        "delete_device",
        "move_device",
        "toggle_device_bypass",
        "add_automation_point",
        "clear_automation",
        // song and transport control
        "set_tempo",
        "set_time_signature",
        "set_metronome",
        "set_loop",
        "set_playhead_position",
        "create_locator",
        "delete_locator",
        "jump_to_locator",
        "start_playback",
        "stop_playback",
        "start_recording",
        "stop_recording",
        "undo",
        "redo",
        // host
        "reload_script"
    );

    private StandardCommands() {
    }

    /**
     * Build a registry containing the full stock catalog.
     */
    public static CommandRegistry registry() {
        return register(CommandRegistry.builder()).build();
    }

    /**
     * Add the stock catalog to an existing builder, so hosts can extend it with
     * their own commands before building.
     */
    public static CommandRegistry.Builder register(CommandRegistry.Builder builder) {
        for (String name : LOSSY_ELIGIBLE) {
            builder.register(name, SafetyTier.LOSSY_ELIGIBLE);
        }
        for (String name : NEVER_LOSSY) {
            builder.register(name, SafetyTier.NEVER_LOSSY);
        }
        return builder;
    }
}
