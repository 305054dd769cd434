package com.seatplanner.backend.modules.layout.application;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.seatplanner.backend.global.error.InvalidRequestException;
import com.seatplanner.backend.global.error.ResourceNotFoundException;
import com.seatplanner.backend.modules.event.domain.SeatingEvent;
import com.seatplanner.backend.modules.event.infrastructure.persistence.SeatingEventRepository;
import com.seatplanner.backend.modules.layout.domain.LayoutIcon;
import com.seatplanner.backend.modules.layout.infrastructure.persistence.LayoutIconRepository;
import com.seatplanner.backend.modules.layout.presentation.dto.CreateIconRequest;
import com.seatplanner.backend.modules.layout.presentation.dto.IconResponse;
import com.seatplanner.backend.modules.layout.presentation.dto.LayoutDtoMapper;
import com.seatplanner.backend.modules.layout.presentation.dto.PositionRequest;

@Service
@Transactional
public class LayoutIconService {

    private final SeatingEventRepository seatingEventRepository;
    private final LayoutIconRepository layoutIconRepository;

    public LayoutIconService(
            SeatingEventRepository seatingEventRepository,
            LayoutIconRepository layoutIconRepository
    ) {
        this.seatingEventRepository = seatingEventRepository;
        this.layoutIconRepository = layoutIconRepository;
    }

    public IconResponse addIcon(Long eventId, CreateIconRequest request) {
        if (request == null || !StringUtils.hasText(request.iconType())) {
            throw new InvalidRequestException("ICON_TYPE_REQUIRED", "Icon type is required");
        }
        if (request.x() == null || request.y() == null) {
            throw new InvalidRequestException("POSITION_REQUIRED", "Both x and y are required");
        }
        SeatingEvent event = seatingEventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("event", eventId));

        LayoutIcon icon = new LayoutIcon();
        icon.setEvent(event);
        icon.setIconType(request.iconType().trim());
        icon.moveTo(request.x(), request.y());
        icon.setSize(request.size() != null ? request.size() : LayoutIcon.DEFAULT_SIZE);
        icon.setRotation(request.rotation() != null ? request.rotation() : 0);
        return LayoutDtoMapper.toIconResponse(layoutIconRepository.save(icon));
    }

    @Transactional(readOnly = true)
    public List<IconResponse> listIcons(Long eventId) {
        SeatingEvent event = seatingEventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("event", eventId));
        return layoutIconRepository.findByEventIdOrderByIdAsc(event.getId()).stream()
                .map(LayoutDtoMapper::toIconResponse)
                .toList();
    }

    public void repositionIcon(Long iconId, PositionRequest request) {
        if (request == null || request.x() == null || request.y() == null) {
            throw new InvalidRequestException("POSITION_REQUIRED", "Both x and y are required");
        }
        LayoutIcon icon = loadIcon(iconId);
        icon.moveTo(request.x(), request.y());
        layoutIconRepository.save(icon);
    }

    public void deleteIcon(Long iconId) {
        layoutIconRepository.delete(loadIcon(iconId));
    }

    private LayoutIcon loadIcon(Long iconId) {
        return layoutIconRepository.findById(iconId)
                .orElseThrow(() -> new ResourceNotFoundException("icon", iconId));
    }
}
