package com.rfidsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * RFID Cache Sync - Aplicación Principal
 *
 * Servidor de cache de acceso para lectores RFID:
 * - Sincroniza miembros y capacitaciones desde Wild Apricot cada 6 minutos
 * - Guarda el estado reconciliado en la base local
 * - Publica snapshots inmutables de las caches de puertas y máquinas
 */
@SpringBootApplication
@EnableScheduling
public class RfidSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(RfidSyncApplication.class, args);
    }
}
