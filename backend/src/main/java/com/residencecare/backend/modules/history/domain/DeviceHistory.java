package com.residencecare.backend.modules.history.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "device_history")
public class DeviceHistory extends AbstractHistoryRecord {
}
